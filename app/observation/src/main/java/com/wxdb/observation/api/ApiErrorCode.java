/*
 * どこで: Observation API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.wxdb.observation.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  OBSERVATION_NOT_FOUND,
  OBSERVATION_CONFLICT,
  AUDIT_WRITE_FAILED,
  UPSTREAM_FAILED,
  DATA_ACCESS_FAILED
}
