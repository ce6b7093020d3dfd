/*
 * どこで: GitHub API DTO
 * 何を: REST の Release 応答を受け取る
 * なぜ: 必要なフィールドだけを snake_case から読むため
 */
package com.example.inbox.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReleaseResponse(
    String name, String tagName, String body, GithubUserResponse author, String htmlUrl) {}
