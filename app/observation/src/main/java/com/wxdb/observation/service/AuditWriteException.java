/*
 * どこで: Observation サービス層
 * 何を: 監査ストアへの書き込み失敗を表す
 * なぜ: 削除トランザクション全体をロールバックさせる唯一の失敗種別として扱うため
 */
package com.wxdb.observation.service;

public class AuditWriteException extends RuntimeException {

  public AuditWriteException(String message) {
    super(message);
  }

  public AuditWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
