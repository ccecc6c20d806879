/*
 * どこで: 共通ユーティリティ
 * 何を: 呼び出し元が渡したリクエスト ID を採用し、無ければ新規採番する
 * なぜ: 上流の X-Request-Id とログの request_id を一致させるため
 */
package com.wxdb.common;

import java.util.UUID;

public final class RequestIds {

  static final int MAX_LENGTH = 64;

  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  /** 受け取った ID が空または長すぎる場合は新規に採番する。 */
  public static String resolve(String candidate) {
    if (candidate == null) {
      return newRequestId();
    }
    final String trimmed = candidate.trim();
    if (trimmed.isEmpty() || trimmed.length() > MAX_LENGTH) {
      return newRequestId();
    }
    return trimmed;
  }
}
