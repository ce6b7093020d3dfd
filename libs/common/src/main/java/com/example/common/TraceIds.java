package com.example.common;

import java.util.UUID;

public final class TraceIds {

  private static final int SHORT_LENGTH = 8;

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** ログ上で相関を取るための短縮 ID。衝突は許容する。 */
  public static String newShortId() {
    return newTraceId().replace("-", "").substring(0, SHORT_LENGTH);
  }
}
