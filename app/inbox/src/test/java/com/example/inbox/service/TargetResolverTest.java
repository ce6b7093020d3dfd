package com.example.inbox.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.inbox.TestNotifications;
import com.example.inbox.config.HydrationProperties;
import com.example.inbox.model.CiBuildTarget;
import com.example.inbox.model.DiscussionMeta;
import com.example.inbox.model.DiscussionState;
import com.example.inbox.model.IssueClosedReason;
import com.example.inbox.model.IssueMeta;
import com.example.inbox.model.IssueState;
import com.example.inbox.model.NotificationStub;
import com.example.inbox.model.NotificationSubject;
import com.example.inbox.model.NotificationTarget;
import com.example.inbox.model.PullRequestMeta;
import com.example.inbox.model.PullRequestState;
import com.example.inbox.model.ReleaseMeta;
import com.example.inbox.model.TargetKind;
import com.example.inbox.model.UnknownTarget;
import com.example.inbox.service.dto.GithubUserResponse;
import com.example.inbox.service.dto.IssueResponse;
import com.example.inbox.service.dto.PullRequestResponse;
import com.example.inbox.service.dto.ReleaseResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TargetResolverTest {

  private static final String ISSUE_URL = "https://api.github.test/repos/octo/inbox/issues/7";
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private GithubClient githubClient;
  private TargetResolver resolver;

  @BeforeEach
  void setUp() {
    githubClient = mock(GithubClient.class);
    resolver = new TargetResolver(githubClient, new HydrationProperties(null, null, null));
  }

  @Test
  void issueWithoutClosedAtIsOpen() {
    when(githubClient.getDetail(ISSUE_URL, IssueResponse.class))
        .thenReturn(
            new IssueResponse(
                "Fix bug",
                7L,
                null,
                new GithubUserResponse("alice"),
                "open",
                null,
                null,
                "2026-01-01T00:00:00Z",
                "https://github.test/octo/inbox/issues/7"));

    final NotificationTarget target = resolver.resolve(stub("1", "Issue", ISSUE_URL));

    assertThat(target).isInstanceOf(IssueMeta.class);
    final IssueMeta issue = (IssueMeta) target;
    assertThat(issue.state()).isEqualTo(IssueState.OPEN);
    assertThat(issue.closedReason()).isNull();
    assertThat(issue.number()).isEqualTo(7L);
    assertThat(issue.author()).isEqualTo("alice");
    assertThat(issue.body()).isEqualTo("No description provided.");
    assertThat(issue.createdAt()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
    assertThat(issue.repo()).isEqualTo(TestNotifications.REPO);
  }

  @Test
  void closedIssueCarriesClosedReason() {
    when(githubClient.getDetail(ISSUE_URL, IssueResponse.class))
        .thenReturn(
            new IssueResponse(
                "Fix bug",
                7L,
                "details",
                new GithubUserResponse("alice"),
                "closed",
                "not_planned",
                "2026-01-02T00:00:00Z",
                "2026-01-01T00:00:00Z",
                "https://github.test/octo/inbox/issues/7"));

    final IssueMeta issue = (IssueMeta) resolver.resolve(stub("1", "Issue", ISSUE_URL));

    assertThat(issue.state()).isEqualTo(IssueState.CLOSED);
    assertThat(issue.closedReason()).isEqualTo(IssueClosedReason.NOT_PLANNED);
    assertThat(issue.body()).isEqualTo("details");
  }

  @Test
  void issueWithoutDetailUrlIsUnknownWithoutNetwork() {
    final NotificationTarget target = resolver.resolve(stub("1", "Issue", null));

    assertThat(target).isEqualTo(UnknownTarget.INSTANCE);
    verifyNoInteractions(githubClient);
  }

  @Test
  void pullRequestStatePrefersMergedOverClosed() {
    final String url = "https://api.github.test/repos/octo/inbox/pulls/3";
    when(githubClient.getDetail(url, PullRequestResponse.class))
        .thenReturn(
            new PullRequestResponse(
                "Add feature",
                3L,
                "desc",
                new GithubUserResponse("bob"),
                "closed",
                "2026-01-02T00:00:00Z",
                "2026-01-02T00:00:00Z",
                "2026-01-01T00:00:00Z",
                "https://github.test/octo/inbox/pull/3"));

    final PullRequestMeta pr = (PullRequestMeta) resolver.resolve(stub("2", "PullRequest", url));

    assertThat(pr.state()).isEqualTo(PullRequestState.MERGED);
    assertThat(pr.htmlUrl()).isEqualTo("https://github.test/octo/inbox/pull/3");
  }

  @Test
  void pullRequestStateFollowsClosedAtThenOpen() {
    assertThat(TargetResolver.pullRequestState(pullRequest(null, "2026-01-02T00:00:00Z")))
        .isEqualTo(PullRequestState.CLOSED);
    assertThat(TargetResolver.pullRequestState(pullRequest(null, null)))
        .isEqualTo(PullRequestState.OPEN);
  }

  @Test
  void releaseTitleFallsBackToTagName() {
    final String url = "https://api.github.test/repos/octo/inbox/releases/1";
    when(githubClient.getDetail(url, ReleaseResponse.class))
        .thenReturn(
            new ReleaseResponse(
                "", "v1.2.0", "notes", new GithubUserResponse("carol"), "https://rel.test"));

    final ReleaseMeta release = (ReleaseMeta) resolver.resolve(stub("3", "Release", url));

    assertThat(release.title()).isEqualTo("v1.2.0");
    assertThat(release.tagName()).isEqualTo("v1.2.0");
    assertThat(release.author()).isEqualTo("carol");
  }

  @Test
  void discussionWithSingleExactMatchIsResolved() throws Exception {
    when(githubClient.graphql(eq(TargetResolver.DISCUSSION_SEARCH_QUERY), anyMap()))
        .thenReturn(
            json(
                """
                {"search":{"nodes":[
                  {"number":12,"title":"How to configure?","url":"https://d.test/12","answer":{"id":"A"}},
                  {"number":13,"title":"How to configure? (again)","url":"https://d.test/13","answer":null}
                ]}}
                """));

    final NotificationTarget target =
        resolver.resolve(discussionStub("4", "How to configure?"));

    assertThat(target).isInstanceOf(DiscussionMeta.class);
    final DiscussionMeta discussion = (DiscussionMeta) target;
    assertThat(discussion.number()).isEqualTo(12L);
    assertThat(discussion.state()).isEqualTo(DiscussionState.ANSWERED);
    assertThat(discussion.htmlUrl()).isEqualTo("https://d.test/12");
  }

  @Test
  void discussionWithoutAnswerIsUnanswered() throws Exception {
    when(githubClient.graphql(eq(TargetResolver.DISCUSSION_SEARCH_QUERY), anyMap()))
        .thenReturn(
            json(
                """
                {"search":{"nodes":[{"number":5,"title":"Idea","url":"https://d.test/5","answer":null}]}}
                """));

    final DiscussionMeta discussion = (DiscussionMeta) resolver.resolve(discussionStub("5", "Idea"));

    assertThat(discussion.state()).isEqualTo(DiscussionState.UNANSWERED);
  }

  @Test
  void discussionWithZeroSearchResultsIsUnknown() throws Exception {
    when(githubClient.graphql(eq(TargetResolver.DISCUSSION_SEARCH_QUERY), anyMap()))
        .thenReturn(json("{\"search\":{\"nodes\":[]}}"));

    final NotificationTarget target = resolver.resolve(discussionStub("6", "Missing"));

    assertThat(target.kind()).isEqualTo(TargetKind.UNKNOWN);
  }

  @Test
  void discussionWithAmbiguousMatchesIsUnknown() throws Exception {
    when(githubClient.graphql(eq(TargetResolver.DISCUSSION_SEARCH_QUERY), anyMap()))
        .thenReturn(
            json(
                """
                {"search":{"nodes":[
                  {"number":1,"title":"Dup","url":"https://d.test/1","answer":null},
                  {"number":2,"title":"Dup","url":"https://d.test/2","answer":null}
                ]}}
                """));

    assertThat(resolver.resolve(discussionStub("7", "Dup"))).isEqualTo(UnknownTarget.INSTANCE);
  }

  @Test
  void discussionSearchIsScopedToRepositoryAndLimit() throws Exception {
    when(githubClient.graphql(eq(TargetResolver.DISCUSSION_SEARCH_QUERY), anyMap()))
        .thenReturn(json("{\"search\":{\"nodes\":[]}}"));

    resolver.resolve(discussionStub("8", "Say \"hi\""));

    verify(githubClient)
        .graphql(
            TargetResolver.DISCUSSION_SEARCH_QUERY,
            Map.of("query", "repo:octo/inbox in:title \"Say hi\"", "first", 5));
  }

  @Test
  void checkSuiteIsCiBuildWithoutNetwork() {
    final NotificationTarget target = resolver.resolve(stub("9", "CheckSuite", null));

    assertThat(target).isEqualTo(CiBuildTarget.INSTANCE);
    verifyNoInteractions(githubClient);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "issue", "RepositoryVulnerabilityAlert", "Commit"})
  void unrecognizedSubjectTypesAreUnknownWithoutNetwork(String type) {
    final NotificationTarget target = resolver.resolve(stub("10", type, ISSUE_URL));

    assertThat(target).isEqualTo(UnknownTarget.INSTANCE);
    verifyNoInteractions(githubClient);
  }

  @Test
  void detailFailureBecomesResolveError() {
    when(githubClient.getDetail(ISSUE_URL, IssueResponse.class))
        .thenThrow(
            new GithubIntegrationException(
                GithubIntegrationException.Reason.NOT_FOUND, "github resource not found"));

    assertThatThrownBy(() -> resolver.resolve(stub("11", "Issue", ISSUE_URL)))
        .isInstanceOf(TargetResolveException.class)
        .hasCauseInstanceOf(GithubIntegrationException.class)
        .extracting(ex -> ((TargetResolveException) ex).stubId())
        .isEqualTo("11");
  }

  @Test
  void issueWithoutNumberIsResolveError() {
    when(githubClient.getDetail(ISSUE_URL, IssueResponse.class))
        .thenReturn(
            new IssueResponse("t", null, null, null, "open", null, null, null, "https://x.test"));

    assertThatThrownBy(() -> resolver.resolve(stub("12", "Issue", ISSUE_URL)))
        .isInstanceOf(TargetResolveException.class);
  }

  private static NotificationStub stub(String id, String type, String detailUrl) {
    return TestNotifications.stub(id, new NotificationSubject(type, "title", detailUrl, null));
  }

  private static NotificationStub discussionStub(String id, String title) {
    return TestNotifications.stub(id, new NotificationSubject("Discussion", title, null, null));
  }

  private static PullRequestResponse pullRequest(String mergedAt, String closedAt) {
    return new PullRequestResponse(
        "t", 1L, "b", null, "open", closedAt, mergedAt, null, "https://x.test");
  }

  private static JsonNode json(String text) throws Exception {
    return MAPPER.readTree(text);
  }
}
