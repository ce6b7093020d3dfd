/*
 * どこで: GitHub API DTO
 * 何を: REST の Issue 応答を受け取る
 * なぜ: 必要なフィールドだけを snake_case から読むため
 */
package com.example.inbox.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IssueResponse(
    String title,
    Long number,
    String body,
    GithubUserResponse user,
    String state,
    String stateReason,
    String closedAt,
    String createdAt,
    String htmlUrl) {}
