/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.task;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import javax.annotation.Nullable;
import okhttp3.MediaType;

/**
 * 不透明的二进制资源：字节内容及其 MIME 类型。
 *
 * <p>提供读取为字节、文本或 data: URL 的方法。
 */
public final class Blob {

  private static final String DEFAULT_TYPE = "application/octet-stream";

  private final byte[] data;
  @Nullable private final String contentType;

  /**
   * 创建 Blob
   *
   * @param data 内容，不做拷贝
   * @param contentType MIME 类型，未知时为 null
   */
  public Blob(byte[] data, @Nullable String contentType) {
    this.data = data;
    this.contentType = contentType;
  }

  /** 内容长度（字节） */
  public int size() {
    return data.length;
  }

  @Nullable
  public String getContentType() {
    return contentType;
  }

  /** 内容的副本 */
  public byte[] toBytes() {
    return Arrays.copyOf(data, data.length);
  }

  /** 按 MIME 类型声明的字符集解码为文本，未声明时使用 UTF-8 */
  public String toText() {
    return new String(data, charsetOf(contentType));
  }

  /** 编码为 {@code data:<type>;base64,<payload>} */
  public String toDataUrl() {
    String type = contentType != null ? contentType : DEFAULT_TYPE;
    return "data:" + type + ";base64," + Base64.getEncoder().encodeToString(data);
  }

  static Charset charsetOf(@Nullable String contentType) {
    if (contentType == null) {
      return StandardCharsets.UTF_8;
    }
    MediaType mediaType = MediaType.parse(contentType);
    if (mediaType == null) {
      return StandardCharsets.UTF_8;
    }
    Charset charset = mediaType.charset(StandardCharsets.UTF_8);
    return charset != null ? charset : StandardCharsets.UTF_8;
  }

  @Override
  public String toString() {
    return "Blob{size=" + data.length + ", contentType=" + contentType + '}';
  }
}
