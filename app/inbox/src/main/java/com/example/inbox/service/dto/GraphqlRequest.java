package com.example.inbox.service.dto;

import java.util.Map;

public record GraphqlRequest(String query, Map<String, Object> variables) {

  public GraphqlRequest {
    variables = variables == null ? Map.of() : Map.copyOf(variables);
  }
}
