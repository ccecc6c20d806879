/*
 * どこで: Observation API
 * 何を: 対象の観測値が存在しない(404)ことを表す例外を定義する
 * なぜ: 削除済み/未登録の行への操作を明確に扱うため
 */
package com.wxdb.observation.api;

public class ObservationNotFoundException extends RuntimeException {

  public ObservationNotFoundException(String message) {
    super(message);
  }
}
