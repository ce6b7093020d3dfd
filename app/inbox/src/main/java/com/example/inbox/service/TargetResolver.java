/*
 * どこで: Inbox サービス層
 * 何を: 通知 stub の subject 種別ごとに追加取得を行い、型付きの対象に変換する
 * なぜ: 一覧 API だけでは状態(open/closed/merged など)が分からないため
 */
package com.example.inbox.service;

import com.example.inbox.config.HydrationProperties;
import com.example.inbox.model.CiBuildTarget;
import com.example.inbox.model.DiscussionMeta;
import com.example.inbox.model.DiscussionState;
import com.example.inbox.model.IssueClosedReason;
import com.example.inbox.model.IssueMeta;
import com.example.inbox.model.IssueState;
import com.example.inbox.model.NotificationStub;
import com.example.inbox.model.NotificationTarget;
import com.example.inbox.model.PullRequestMeta;
import com.example.inbox.model.PullRequestState;
import com.example.inbox.model.ReleaseMeta;
import com.example.inbox.model.SubjectType;
import com.example.inbox.model.UnknownTarget;
import com.example.inbox.service.dto.GithubUserResponse;
import com.example.inbox.service.dto.IssueResponse;
import com.example.inbox.service.dto.PullRequestResponse;
import com.example.inbox.service.dto.ReleaseResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TargetResolver {

  private static final Logger logger = LoggerFactory.getLogger(TargetResolver.class);

  static final String NO_DESCRIPTION = "No description provided.";

  static final String DISCUSSION_SEARCH_QUERY =
      """
      query DiscussionSearch($query: String!, $first: Int!) {
        search(query: $query, type: DISCUSSION, first: $first) {
          nodes {
            ... on Discussion {
              number
              title
              url
              answer { id }
            }
          }
        }
      }
      """;

  private final GithubClient githubClient;
  private final HydrationProperties hydrationProperties;

  /**
   * stub を型付きの対象に解決する。
   *
   * <p>未知の subject 種別と CheckSuite はネットワークに触れない。Discussion の検索結果が一意に決まらない場合は
   * {@link UnknownTarget} を返し、エラーにはしない。
   *
   * @throws TargetResolveException Issue/PullRequest/Release の詳細取得や Discussion 検索が失敗した場合
   */
  public NotificationTarget resolve(NotificationStub stub) {
    final SubjectType type = SubjectType.classify(stub.subject().type());
    try {
      return switch (type) {
        case ISSUE -> resolveIssue(stub);
        case PULL_REQUEST -> resolvePullRequest(stub);
        case RELEASE -> resolveRelease(stub);
        case DISCUSSION -> resolveDiscussion(stub);
        case CHECK_SUITE -> CiBuildTarget.INSTANCE;
        case UNKNOWN -> UnknownTarget.INSTANCE;
      };
    } catch (GithubIntegrationException ex) {
      throw new TargetResolveException(
          stub.id(),
          "failed to resolve " + type.tag() + " notification id=" + stub.id(),
          ex);
    }
  }

  private NotificationTarget resolveIssue(NotificationStub stub) {
    final Optional<String> url = stub.subject().detailUrlIfPresent();
    if (url.isEmpty()) {
      logger.debug("issue notification has no detail url id={}", stub.id());
      return UnknownTarget.INSTANCE;
    }
    final IssueResponse issue = githubClient.getDetail(url.get(), IssueResponse.class);
    // state 文字列ではなく closed_at の有無で判定する
    final IssueState state = issue.closedAt() == null ? IssueState.OPEN : IssueState.CLOSED;
    return new IssueMeta(
        stub.repository(),
        titleOr(issue.title(), stub),
        bodyOrDefault(issue.body()),
        requireNumber(issue.number(), stub),
        login(issue.user()),
        state,
        IssueClosedReason.fromStateReason(issue.stateReason()),
        GithubTimestamps.parseOrNull(issue.createdAt()),
        issue.htmlUrl());
  }

  private NotificationTarget resolvePullRequest(NotificationStub stub) {
    final Optional<String> url = stub.subject().detailUrlIfPresent();
    if (url.isEmpty()) {
      logger.debug("pull request notification has no detail url id={}", stub.id());
      return UnknownTarget.INSTANCE;
    }
    final PullRequestResponse pr = githubClient.getDetail(url.get(), PullRequestResponse.class);
    return new PullRequestMeta(
        stub.repository(),
        titleOr(pr.title(), stub),
        bodyOrDefault(pr.body()),
        requireNumber(pr.number(), stub),
        login(pr.user()),
        pullRequestState(pr),
        GithubTimestamps.parseOrNull(pr.createdAt()),
        pr.htmlUrl());
  }

  private NotificationTarget resolveRelease(NotificationStub stub) {
    final Optional<String> url = stub.subject().detailUrlIfPresent();
    if (url.isEmpty()) {
      logger.debug("release notification has no detail url id={}", stub.id());
      return UnknownTarget.INSTANCE;
    }
    final ReleaseResponse release = githubClient.getDetail(url.get(), ReleaseResponse.class);
    final String tagName = release.tagName() == null ? "" : release.tagName();
    final String title =
        release.name() == null || release.name().isBlank() ? tagName : release.name();
    return new ReleaseMeta(
        stub.repository(),
        title,
        bodyOrDefault(release.body()),
        login(release.author()),
        tagName,
        release.htmlUrl());
  }

  private NotificationTarget resolveDiscussion(NotificationStub stub) {
    final String title = stub.subject().title();
    final JsonNode data =
        githubClient.graphql(
            DISCUSSION_SEARCH_QUERY,
            Map.of(
                "query", searchQuery(stub.repository().fullName(), title),
                "first", hydrationProperties.discussionSearchLimit()));
    final List<JsonNode> matches = new ArrayList<>();
    for (JsonNode node : data.path("search").path("nodes")) {
      if (title.equals(node.path("title").asText(null))) {
        matches.add(node);
      }
    }
    if (matches.size() != 1) {
      logger.info(
          "discussion search did not find a unique match id={} matches={}",
          stub.id(),
          matches.size());
      return UnknownTarget.INSTANCE;
    }
    final JsonNode match = matches.get(0);
    if (!match.path("number").canConvertToLong()) {
      throw new GithubIntegrationException(
          GithubIntegrationException.Reason.INVALID_RESPONSE,
          "discussion search result has no number id=" + stub.id());
    }
    final JsonNode answer = match.path("answer");
    final DiscussionState state =
        answer.isMissingNode() || answer.isNull()
            ? DiscussionState.UNANSWERED
            : DiscussionState.ANSWERED;
    return new DiscussionMeta(
        stub.repository(),
        title,
        match.path("number").asLong(),
        state,
        match.path("url").asText(""));
  }

  @VisibleForTesting
  static String searchQuery(String repoFullName, String title) {
    // タイトル内の二重引用符はフレーズ検索を壊すので落とす
    return "repo:" + repoFullName + " in:title \"" + title.replace("\"", "") + "\"";
  }

  @VisibleForTesting
  static PullRequestState pullRequestState(PullRequestResponse pr) {
    if (pr.mergedAt() != null) {
      return PullRequestState.MERGED;
    }
    if (pr.closedAt() != null) {
      return PullRequestState.CLOSED;
    }
    return PullRequestState.OPEN;
  }

  private long requireNumber(Long number, NotificationStub stub) {
    if (number == null) {
      throw new GithubIntegrationException(
          GithubIntegrationException.Reason.INVALID_RESPONSE,
          "detail response has no number id=" + stub.id());
    }
    return number;
  }

  private String titleOr(String title, NotificationStub stub) {
    return title == null || title.isBlank() ? stub.subject().title() : title;
  }

  private String bodyOrDefault(String body) {
    return body == null || body.isBlank() ? NO_DESCRIPTION : body;
  }

  private String login(GithubUserResponse user) {
    return user == null || user.login() == null ? "" : user.login();
  }
}
