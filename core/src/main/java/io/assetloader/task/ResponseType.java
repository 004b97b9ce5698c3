/*
 * Copyright The Asset Loader Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.assetloader.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import javax.annotation.Nullable;

/**
 * 响应内容的表示形式
 *
 * @param <T> 解码后的类型
 */
@FunctionalInterface
public interface ResponseType<T> {

  /** 原始字节 */
  ResponseType<byte[]> BINARY = (body, contentType, mapper) -> body;

  /** 文本，字符集取自 Content-Type，默认 UTF-8 */
  ResponseType<String> TEXT =
      (body, contentType, mapper) -> new String(body, Blob.charsetOf(contentType));

  /** JSON 树 */
  ResponseType<JsonNode> JSON = (body, contentType, mapper) -> mapper.readTree(body);

  /** 带 MIME 类型的不透明二进制 */
  ResponseType<Blob> BLOB = (body, contentType, mapper) -> new Blob(body, contentType);

  /**
   * 绑定到指定类型的 JSON
   *
   * @param type 目标类型
   * @param <T> 目标类型
   * @return 响应类型
   */
  static <T> ResponseType<T> json(Class<T> type) {
    return (body, contentType, mapper) -> mapper.readValue(body, type);
  }

  /**
   * 解码响应内容
   *
   * @param body 响应内容
   * @param contentType Content-Type，未知时为 null
   * @param mapper JSON 解析器
   * @return 解码结果
   * @throws IOException 解码失败
   */
  T decode(byte[] body, @Nullable String contentType, ObjectMapper mapper) throws IOException;
}
