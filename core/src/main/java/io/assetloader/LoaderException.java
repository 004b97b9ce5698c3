/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader;

import javax.annotation.Nullable;

/**
 * 资源加载异常
 *
 * <p>封装加载过程中的各类失败，并标记该失败是否可以通过重试恢复。
 */
public class LoaderException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** 异常类型 */
  public enum Type {
    /** 网络传输失败 */
    NETWORK_ERROR,
    /** 响应状态码不可接受 */
    HTTP_STATUS,
    /** 解码失败 */
    DECODE_FAILED,
    /** 被主动取消 */
    ABORTED,
    /** 配置错误 */
    CONFIG_ERROR
  }

  private final Type type;
  private final boolean recoverable;

  /**
   * 创建加载异常
   *
   * @param type 异常类型
   * @param message 异常消息
   */
  public LoaderException(Type type, String message) {
    this(type, message, null, isRecoverableType(type));
  }

  /**
   * 创建加载异常
   *
   * @param type 异常类型
   * @param message 异常消息
   * @param cause 原始异常
   */
  public LoaderException(Type type, String message, @Nullable Throwable cause) {
    this(type, message, cause, isRecoverableType(type));
  }

  /**
   * 创建加载异常
   *
   * @param type 异常类型
   * @param message 异常消息
   * @param cause 原始异常
   * @param recoverable 是否可恢复
   */
  public LoaderException(
      Type type, String message, @Nullable Throwable cause, boolean recoverable) {
    super(formatMessage(type, message), cause);
    this.type = type;
    this.recoverable = recoverable;
  }

  public Type getType() {
    return type;
  }

  /**
   * 检查异常是否可恢复（可重试）
   *
   * @return 是否可恢复
   */
  public boolean isRecoverable() {
    return recoverable;
  }

  /** 是否为取消导致的异常 */
  public boolean isAborted() {
    return type == Type.ABORTED;
  }

  private static boolean isRecoverableType(Type type) {
    switch (type) {
      case NETWORK_ERROR:
      case HTTP_STATUS:
      case DECODE_FAILED:
        return true;
      case ABORTED:
      case CONFIG_ERROR:
      default:
        return false;
    }
  }

  private static String formatMessage(Type type, String message) {
    return "[" + type.name() + "] " + message;
  }

  // ===== 便捷工厂方法 =====

  public static LoaderException networkError(String message, @Nullable Throwable cause) {
    return new LoaderException(Type.NETWORK_ERROR, message, cause);
  }

  public static LoaderException httpStatus(String message) {
    return new LoaderException(Type.HTTP_STATUS, message);
  }

  public static LoaderException decodeFailed(String message, @Nullable Throwable cause) {
    return new LoaderException(Type.DECODE_FAILED, message, cause);
  }

  public static LoaderException aborted(String message) {
    return new LoaderException(Type.ABORTED, message);
  }

  public static LoaderException configError(String message, @Nullable Throwable cause) {
    return new LoaderException(Type.CONFIG_ERROR, message, cause);
  }
}
