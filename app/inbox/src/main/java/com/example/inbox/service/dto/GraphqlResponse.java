/*
 * どこで: GitHub API DTO
 * 何を: GraphQL 応答の data と errors を保持する
 * なぜ: エラーの有無を data の読み取りより先に判定するため
 */
package com.example.inbox.service.dto;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/** errors の null 要素は取り除く。 */
public record GraphqlResponse(JsonNode data, List<GraphqlError> errors) {

  public GraphqlResponse {
    errors = errors == null ? List.of() : errors.stream().filter(Objects::nonNull).toList();
  }

  public record GraphqlError(String type, String message) {}
}
