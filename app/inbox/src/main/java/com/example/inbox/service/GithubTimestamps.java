/*
 * どこで: Inbox サービス層
 * 何を: GitHub の ISO-8601 時刻文字列を Instant に変換する
 * なぜ: 不正な時刻を INVALID_RESPONSE として扱いを揃えるため
 */
package com.example.inbox.service;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/** GitHub が返す ISO-8601 (UTC) の時刻文字列を扱う。 */
final class GithubTimestamps {

  private GithubTimestamps() {}

  /** 空なら null。形式が不正なら INVALID_RESPONSE。 */
  static Instant parseOrNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ex) {
      throw new GithubIntegrationException(
          GithubIntegrationException.Reason.INVALID_RESPONSE, "invalid timestamp: " + value, ex);
    }
  }
}
