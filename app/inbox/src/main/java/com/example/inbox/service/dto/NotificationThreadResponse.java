/*
 * どこで: Inbox 下流 DTO
 * 何を: GET /notifications の 1 要素 (thread) を表現する
 * なぜ: 一覧応答を型付きで受けて stub へ変換するため
 */
package com.example.inbox.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationThreadResponse(
    String id,
    boolean unread,
    String updatedAt,
    Subject subject,
    Repository repository,
    String url) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Subject(String title, String url, String latestCommentUrl, String type) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Repository(String name, String fullName, GithubUserResponse owner) {}
}
