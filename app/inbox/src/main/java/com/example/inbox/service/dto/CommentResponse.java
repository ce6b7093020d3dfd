/*
 * どこで: GitHub API DTO
 * 何を: REST のコメント応答から html_url だけを受け取る
 * なぜ: 最新コメントをブラウザで開く URL を解決するため
 */
package com.example.inbox.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CommentResponse(String htmlUrl) {}
