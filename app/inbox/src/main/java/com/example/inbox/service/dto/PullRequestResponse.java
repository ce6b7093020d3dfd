/*
 * どこで: GitHub API DTO
 * 何を: REST の Pull Request 応答を受け取る
 * なぜ: 必要なフィールドだけを snake_case から読むため
 */
package com.example.inbox.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PullRequestResponse(
    String title,
    Long number,
    String body,
    GithubUserResponse user,
    String state,
    String closedAt,
    String mergedAt,
    String createdAt,
    String htmlUrl) {}
