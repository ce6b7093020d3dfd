/*
 * どこで: Inbox サービス層
 * 何を: 通知を開いたときに Issue/PR のタイムラインや Discussion の回答を GraphQL で取得する
 * なぜ: 一覧の hydration では重い取得を避け、選択された 1 件だけを遅延ロードするため
 */
package com.example.inbox.service;

import com.example.inbox.model.DiscussionMeta;
import com.example.inbox.model.IssueMeta;
import com.example.inbox.model.Notification;
import com.example.inbox.model.NotificationTarget;
import com.example.inbox.model.PullRequestMeta;
import com.example.inbox.model.ReleaseMeta;
import com.example.inbox.model.RepoMeta;
import com.example.inbox.model.detail.DiscussionAnswer;
import com.example.inbox.model.detail.DiscussionDetail;
import com.example.inbox.model.detail.DiscussionReply;
import com.example.inbox.model.detail.IssueDetail;
import com.example.inbox.model.detail.ItemDetail;
import com.example.inbox.model.detail.PullRequestDetail;
import com.example.inbox.model.detail.ReleaseDetail;
import com.example.inbox.model.detail.TimelineEvent;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ItemDetailService {

  private static final Logger logger = LoggerFactory.getLogger(ItemDetailService.class);

  // GraphQL の connection が 1 回で返せる上限
  static final int PAGE_SIZE = 100;

  private static final String ACTOR = "actor { login } createdAt";

  private static final String SOURCE =
      "__typename ... on Issue { number title repository { name owner { login } } }"
          + " ... on PullRequest { number title repository { name owner { login } } }";

  private static final String COMMON_TIMELINE_ITEMS =
      """
      ... on IssueComment { author { login } body createdAt }
      ... on ClosedEvent { %1$s closer { __typename ... on Commit { abbreviatedOid } ... on PullRequest { number } } }
      ... on ReopenedEvent { %1$s }
      ... on LabeledEvent { %1$s label { name } }
      ... on UnlabeledEvent { %1$s label { name } }
      ... on AssignedEvent { %1$s assignee { ... on Actor { login } } }
      ... on UnassignedEvent { %1$s assignee { ... on Actor { login } } }
      ... on RenamedTitleEvent { %1$s previousTitle currentTitle }
      ... on CrossReferencedEvent { %1$s isCrossRepository source { %2$s } }
      ... on ReferencedEvent { %1$s isCrossRepository commit { messageHeadline } commitRepository { name owner { login } } }
      ... on ConnectedEvent { %1$s source { %2$s } }
      ... on LockedEvent { %1$s lockReason }
      ... on UnlockedEvent { %1$s }
      ... on MilestonedEvent { %1$s milestoneTitle }
      ... on PinnedEvent { %1$s }
      ... on UnpinnedEvent { %1$s }
      ... on MarkedAsDuplicateEvent { %1$s canonical { %2$s } }
      ... on UnmarkedAsDuplicateEvent { %1$s }
      """
          .formatted(ACTOR, SOURCE);

  private static final String PULL_REQUEST_TIMELINE_ITEMS =
      """
      ... on MergedEvent { %1$s mergeRefName }
      ... on PullRequestReview { author { login } createdAt state body }
      ... on ReviewRequestedEvent { %1$s requestedReviewer { ... on Actor { login } ... on Team { name } } }
      ... on PullRequestCommit { commit { messageHeadline abbreviatedOid committedDate committer { name user { login } } } }
      ... on HeadRefDeletedEvent { %1$s headRefName }
      ... on HeadRefForcePushedEvent { %1$s beforeCommit { abbreviatedOid } afterCommit { abbreviatedOid } }
      ... on ConvertToDraftEvent { %1$s }
      ... on ReadyForReviewEvent { %1$s }
      """
          .formatted(ACTOR);

  static final String ISSUE_TIMELINE_QUERY =
      """
      query IssueTimeline($owner: String!, $repo: String!, $number: Int!, $first: Int!) {
        repository(owner: $owner, name: $repo) {
          issue(number: $number) {
            timelineItems(first: $first) {
              nodes {
                __typename
                %s
              }
            }
          }
        }
      }
      """
          .formatted(COMMON_TIMELINE_ITEMS);

  static final String PULL_REQUEST_TIMELINE_QUERY =
      """
      query PullRequestTimeline($owner: String!, $repo: String!, $number: Int!, $first: Int!) {
        repository(owner: $owner, name: $repo) {
          pullRequest(number: $number) {
            timelineItems(first: $first) {
              nodes {
                __typename
                %s
                %s
              }
            }
          }
        }
      }
      """
          .formatted(COMMON_TIMELINE_ITEMS, PULL_REQUEST_TIMELINE_ITEMS);

  static final String DISCUSSION_QUERY =
      """
      query DiscussionDetail($owner: String!, $repo: String!, $number: Int!, $first: Int!) {
        repository(owner: $owner, name: $repo) {
          discussion(number: $number) {
            author { login }
            upvoteCount
            body
            createdAt
            comments(first: $first) {
              nodes {
                author { login }
                isAnswer
                upvoteCount
                body
                createdAt
                replies(first: $first) {
                  nodes { author { login } body createdAt }
                }
              }
            }
          }
        }
      }
      """;

  private final GithubClient githubClient;

  /**
   * 通知の詳細ビューを読み込む。Release は追加取得しない。
   *
   * @throws UnsupportedTargetException CiBuild と Unknown のように詳細ビューを持たない場合
   */
  public ItemDetail load(Notification notification) {
    final NotificationTarget target = notification.target();
    if (target instanceof IssueMeta issue) {
      return new IssueDetail(issue, issueTimeline(issue));
    }
    if (target instanceof PullRequestMeta pr) {
      return new PullRequestDetail(pr, pullRequestTimeline(pr));
    }
    if (target instanceof DiscussionMeta discussion) {
      return discussion(discussion);
    }
    if (target instanceof ReleaseMeta release) {
      return new ReleaseDetail(release);
    }
    throw new UnsupportedTargetException(
        target.kind(), "no detail view for " + target.kind() + " id=" + notification.id());
  }

  private List<TimelineEvent> issueTimeline(IssueMeta issue) {
    final JsonNode data =
        githubClient.graphql(ISSUE_TIMELINE_QUERY, variables(issue.repo(), issue.number()));
    final List<TimelineEvent> events =
        TimelineEventParser.parseAll(
            data.path("repository").path("issue").path("timelineItems").path("nodes"));
    logger.debug(
        "issue timeline loaded repo={} number={} events={}",
        issue.repo().fullName(),
        issue.number(),
        events.size());
    return events;
  }

  private List<TimelineEvent> pullRequestTimeline(PullRequestMeta pr) {
    final JsonNode data =
        githubClient.graphql(PULL_REQUEST_TIMELINE_QUERY, variables(pr.repo(), pr.number()));
    return TimelineEventParser.parseAll(
        data.path("repository").path("pullRequest").path("timelineItems").path("nodes"));
  }

  private DiscussionDetail discussion(DiscussionMeta meta) {
    final JsonNode data =
        githubClient.graphql(DISCUSSION_QUERY, variables(meta.repo(), meta.number()));
    final JsonNode discussion = data.path("repository").path("discussion");
    if (discussion.isMissingNode() || discussion.isNull()) {
      logger.info(
          "discussion not returned repo={} number={}", meta.repo().fullName(), meta.number());
      return new DiscussionDetail(meta, "", 0, TargetResolver.NO_DESCRIPTION, null, List.of());
    }
    final List<DiscussionAnswer> answers = new ArrayList<>();
    for (JsonNode comment : discussion.path("comments").path("nodes")) {
      if (comment.isNull()) {
        continue;
      }
      answers.add(
          new DiscussionAnswer(
              login(comment),
              comment.path("isAnswer").asBoolean(false),
              comment.path("upvoteCount").asInt(0),
              comment.path("body").asText(""),
              GithubTimestamps.parseOrNull(comment.path("createdAt").asText(null)),
              replies(comment.path("replies").path("nodes"))));
    }
    return new DiscussionDetail(
        meta,
        login(discussion),
        discussion.path("upvoteCount").asInt(0),
        discussion.path("body").asText(""),
        GithubTimestamps.parseOrNull(discussion.path("createdAt").asText(null)),
        answers);
  }

  private List<DiscussionReply> replies(JsonNode nodes) {
    final List<DiscussionReply> replies = new ArrayList<>();
    for (JsonNode reply : nodes) {
      if (reply.isNull()) {
        continue;
      }
      replies.add(
          new DiscussionReply(
              login(reply),
              reply.path("body").asText(""),
              GithubTimestamps.parseOrNull(reply.path("createdAt").asText(null))));
    }
    return replies;
  }

  private String login(JsonNode node) {
    return node.path("author").path("login").asText("");
  }

  private Map<String, Object> variables(RepoMeta repo, long number) {
    return Map.of(
        "owner", repo.owner(), "repo", repo.name(), "number", number, "first", PAGE_SIZE);
  }
}
