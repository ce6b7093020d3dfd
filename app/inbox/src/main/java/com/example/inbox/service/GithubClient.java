/*
 * どこで: Inbox サービス層
 * 何を: GitHub REST/GraphQL 呼び出しを担当する唯一のクライアント
 * なぜ: 認証済みセッションを共有し、下流エラーを GithubIntegrationException に揃えるため
 */
package com.example.inbox.service;

import com.example.inbox.config.GithubClientProperties;
import com.example.inbox.service.dto.GraphqlRequest;
import com.example.inbox.service.dto.GraphqlResponse;
import com.example.inbox.service.dto.NotificationPage;
import com.example.inbox.service.dto.NotificationThreadResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

@Service
public class GithubClient {

  private static final Logger logger = LoggerFactory.getLogger(GithubClient.class);
  private static final String RATE_LIMIT_REMAINING_HEADER = "X-RateLimit-Remaining";
  private static final String GRAPHQL_RATE_LIMITED = "RATE_LIMITED";
  private static final ParameterizedTypeReference<List<NotificationThreadResponse>> THREAD_LIST =
      new ParameterizedTypeReference<>() {};

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient githubRestClient;

  private final GithubClientProperties properties;

  public GithubClient(RestClient githubRestClient, GithubClientProperties properties) {
    this.githubRestClient = githubRestClient;
    this.properties = properties;
  }

  public NotificationPage listNotifications(int page) {
    if (page < 1) {
      throw new IllegalArgumentException("page must be >= 1");
    }
    try {
      final ResponseEntity<List<NotificationThreadResponse>> response =
          githubRestClient
              .get()
              .uri(
                  uriBuilder ->
                      uriBuilder
                          .path(properties.notificationsPath())
                          .queryParam("page", page)
                          .queryParam("per_page", properties.perPage())
                          .build())
              .retrieve()
              .toEntity(THREAD_LIST);
      final List<NotificationThreadResponse> items = requireThreads(response.getBody());
      final int lastPage =
          parseLastPage(response.getHeaders().getFirst(HttpHeaders.LINK), page);
      return new NotificationPage(items, lastPage);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "listNotifications");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "listNotifications");
    } catch (GithubIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("github listNotifications response parse failed page={}", page, ex);
      throw new GithubIntegrationException(
          GithubIntegrationException.Reason.INVALID_RESPONSE,
          "notification list response parse failed",
          ex);
    }
  }

  /** stub の subject.url のような API の絶対 URL をそのまま GET する。 */
  public <T> T getDetail(String apiUrl, Class<T> responseType) {
    if (apiUrl == null || apiUrl.isBlank()) {
      throw new IllegalArgumentException("apiUrl is required");
    }
    try {
      final T body = githubRestClient.get().uri(URI.create(apiUrl)).retrieve().body(responseType);
      if (body == null) {
        throw new GithubIntegrationException(
            GithubIntegrationException.Reason.INVALID_RESPONSE,
            "detail response is empty url=" + apiUrl);
      }
      return body;
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "getDetail");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "getDetail");
    } catch (GithubIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("github getDetail response parse failed url={}", apiUrl, ex);
      throw new GithubIntegrationException(
          GithubIntegrationException.Reason.INVALID_RESPONSE, "detail response parse failed", ex);
    }
  }

  /** GraphQL の data を返す。errors が付いていれば失敗とする。 */
  public JsonNode graphql(String query, Map<String, Object> variables) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("query is required");
    }
    final GraphqlResponse response;
    try {
      response =
          githubRestClient
              .post()
              .uri(properties.graphqlPath())
              .body(new GraphqlRequest(query, variables))
              .retrieve()
              .body(GraphqlResponse.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "graphql");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "graphql");
    } catch (RuntimeException ex) {
      logger.warn("github graphql response parse failed", ex);
      throw new GithubIntegrationException(
          GithubIntegrationException.Reason.INVALID_RESPONSE, "graphql response parse failed", ex);
    }
    if (response == null) {
      throw new GithubIntegrationException(
          GithubIntegrationException.Reason.INVALID_RESPONSE, "graphql response is empty");
    }
    if (!response.errors().isEmpty()) {
      throw mapGraphqlErrors(response.errors());
    }
    final JsonNode data = response.data();
    return data == null || data.isNull() ? MissingNode.getInstance() : data;
  }

  public void markThreadAsRead(String threadId) {
    if (threadId == null || threadId.isBlank()) {
      throw new IllegalArgumentException("threadId is required");
    }
    try {
      githubRestClient
          .patch()
          .uri(properties.markReadPath(), threadId)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "markThreadAsRead");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "markThreadAsRead");
    }
  }

  @VisibleForTesting
  static int parseLastPage(String linkHeader, int currentPage) {
    if (linkHeader == null || linkHeader.isBlank()) {
      return currentPage;
    }
    for (String link : linkHeader.split(",")) {
      final String[] parts = link.split(";");
      if (parts.length < 2 || !isLastRelation(parts)) {
        continue;
      }
      final String target = parts[0].trim();
      if (!target.startsWith("<") || !target.endsWith(">")) {
        continue;
      }
      final String page =
          UriComponentsBuilder.fromUriString(target.substring(1, target.length() - 1))
              .build()
              .getQueryParams()
              .getFirst("page");
      if (page == null) {
        continue;
      }
      try {
        return Math.max(currentPage, Integer.parseInt(page));
      } catch (NumberFormatException ex) {
        logger.warn("github link header has non numeric page value={}", page);
      }
    }
    return currentPage;
  }

  private static boolean isLastRelation(String[] parts) {
    for (int i = 1; i < parts.length; i++) {
      if (parts[i].trim().equals("rel=\"last\"")) {
        return true;
      }
    }
    return false;
  }

  private List<NotificationThreadResponse> requireThreads(
      List<NotificationThreadResponse> threads) {
    if (threads == null) {
      throw new GithubIntegrationException(
          GithubIntegrationException.Reason.INVALID_RESPONSE, "notification list is empty");
    }
    for (NotificationThreadResponse thread : threads) {
      if (thread == null || isBlank(thread.id()) || thread.subject() == null) {
        throw new GithubIntegrationException(
            GithubIntegrationException.Reason.INVALID_RESPONSE,
            "notification thread is missing id or subject");
      }
    }
    return threads;
  }

  private GithubIntegrationException mapGraphqlErrors(List<GraphqlResponse.GraphqlError> errors) {
    final String messages =
        errors.stream()
            .map(error -> String.valueOf(error.message()))
            .collect(Collectors.joining("; "));
    final boolean rateLimited =
        errors.stream()
            .anyMatch(
                error ->
                    GRAPHQL_RATE_LIMITED.equals(error.type())
                        || mentionsRateLimit(error.message()));
    logger.warn("github graphql returned errors rateLimited={} messages={}", rateLimited, messages);
    if (rateLimited) {
      return new GithubIntegrationException(
          GithubIntegrationException.Reason.RATE_LIMITED, "graphql rate limit exceeded");
    }
    return new GithubIntegrationException(
        GithubIntegrationException.Reason.INVALID_RESPONSE, "graphql errors: " + messages);
  }

  private GithubIntegrationException mapResponseException(
      RestClientResponseException ex, String operation) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "github {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    if (status == 401) {
      return new GithubIntegrationException(
          GithubIntegrationException.Reason.UNAUTHORIZED, "github rejected the token", ex);
    }
    if (isRateLimited(ex)) {
      return new GithubIntegrationException(
          GithubIntegrationException.Reason.RATE_LIMITED, "github rate limit exceeded", ex);
    }
    if (status == 403) {
      return new GithubIntegrationException(
          GithubIntegrationException.Reason.FORBIDDEN, "github denied access", ex);
    }
    if (status == 404) {
      return new GithubIntegrationException(
          GithubIntegrationException.Reason.NOT_FOUND, "github resource not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new GithubIntegrationException(
          GithubIntegrationException.Reason.BAD_GATEWAY, "github server error", ex);
    }
    return new GithubIntegrationException(
        GithubIntegrationException.Reason.BAD_GATEWAY, "github request failed", ex);
  }

  private GithubIntegrationException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("github {} timed out", operation);
      return new GithubIntegrationException(
          GithubIntegrationException.Reason.TIMEOUT, "github request timeout", ex);
    }
    logger.warn("github {} connection failed", operation, ex);
    return new GithubIntegrationException(
        GithubIntegrationException.Reason.BAD_GATEWAY, "github connection failed", ex);
  }

  @VisibleForTesting
  static boolean isRateLimited(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    if (status == 429) {
      return true;
    }
    if (status != 403) {
      return false;
    }
    final HttpHeaders headers = ex.getResponseHeaders();
    if (headers != null && "0".equals(headers.getFirst(RATE_LIMIT_REMAINING_HEADER))) {
      return true;
    }
    return mentionsRateLimit(ex.getResponseBodyAsString());
  }

  private static boolean mentionsRateLimit(String message) {
    return message != null && message.toLowerCase(Locale.ROOT).contains("rate limit");
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
