/*
 * どこで: Observation サービス層
 * 何を: CDEC 上流呼び出しの失敗を表現する
 * なぜ: API 層で HTTP ステータスへ一貫変換し、観測点単位のスキップ判定にも使うため
 */
package com.wxdb.observation.service;

public class CdecIntegrationException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public CdecIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public CdecIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
