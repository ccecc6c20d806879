/*
 * どこで: Observation API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: クライアントがエラー原因を識別し、request_id でサーバーログと突き合わせられるようにするため
 */
package com.wxdb.observation.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.slf4j.MDC;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(ApiErrorCode code, String message, String requestId) {

  /** 現在のリクエストの MDC から request_id を引き継いで生成する。 */
  public static ApiErrorResponse of(ApiErrorCode code, String message) {
    return new ApiErrorResponse(code, message, MDC.get("request_id"));
  }
}
