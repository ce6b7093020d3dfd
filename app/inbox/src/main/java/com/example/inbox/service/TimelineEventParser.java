/*
 * どこで: Inbox サービス層
 * 何を: GraphQL の timelineItems を TimelineEvent の列に変換する
 * なぜ: __typename ごとの読み分けを詳細ロード処理から切り離すため
 */
package com.example.inbox.service;

import com.example.inbox.model.detail.EventKind;
import com.example.inbox.model.detail.TimelineEvent;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** GraphQL の timelineItems.nodes を {@link TimelineEvent} に変換する。 */
final class TimelineEventParser {

  static final String TYPENAME = "typename";

  private TimelineEventParser() {}

  /** nodes が無い、または配列でなければ空リスト。null 要素は読み飛ばす。 */
  static List<TimelineEvent> parseAll(JsonNode nodes) {
    if (nodes == null || !nodes.isArray()) {
      return List.of();
    }
    final List<TimelineEvent> events = new ArrayList<>(nodes.size());
    for (JsonNode node : nodes) {
      if (node == null || node.isNull()) {
        continue;
      }
      events.add(parse(node));
    }
    return events;
  }

  static TimelineEvent parse(JsonNode node) {
    final String typename = node.path("__typename").asText("");
    final EventKind kind = EventKind.fromTypename(typename);
    final Map<String, String> attributes = new HashMap<>();
    String actor = login(node.path("actor"));
    Instant createdAt = timestamp(node.path("createdAt"));
    switch (kind) {
      case COMMENTED -> {
        actor = login(node.path("author"));
        put(attributes, "body", node.path("body"));
      }
      case CLOSED -> {
        final JsonNode closer = node.path("closer");
        if (closer.has("abbreviatedOid")) {
          put(attributes, "closer", closer.path("abbreviatedOid"));
        } else if (closer.has("number")) {
          attributes.put("closer", "#" + closer.path("number").asText());
        }
      }
      case LABELED, UNLABELED -> put(attributes, "label", node.path("label").path("name"));
      case ASSIGNED, UNASSIGNED ->
          put(attributes, "assignee", node.path("assignee").path("login"));
      case RENAMED -> {
        put(attributes, "from", node.path("previousTitle"));
        put(attributes, "to", node.path("currentTitle"));
      }
      case CROSS_REFERENCED -> {
        putSource(attributes, node.path("source"));
        if (node.path("isCrossRepository").asBoolean(false)) {
          putRepository(attributes, node.path("source").path("repository"));
        }
      }
      case CONNECTED -> putSource(attributes, node.path("source"));
      case REFERENCED -> {
        put(attributes, "commit_message", node.path("commit").path("messageHeadline"));
        if (node.path("isCrossRepository").asBoolean(false)) {
          putRepository(attributes, node.path("commitRepository"));
        }
      }
      case LOCKED -> put(attributes, "reason", node.path("lockReason"));
      case MILESTONED -> put(attributes, "title", node.path("milestoneTitle"));
      case MARKED_AS_DUPLICATE -> putSource(attributes, node.path("canonical"));
      case MERGED -> put(attributes, "base_branch", node.path("mergeRefName"));
      case HEAD_REF_DELETED -> put(attributes, "branch", node.path("headRefName"));
      case HEAD_REF_FORCE_PUSHED -> {
        put(attributes, "before", node.path("beforeCommit").path("abbreviatedOid"));
        put(attributes, "after", node.path("afterCommit").path("abbreviatedOid"));
      }
      case REVIEWED -> {
        actor = login(node.path("author"));
        put(attributes, "state", node.path("state"));
        put(attributes, "body", node.path("body"));
      }
      case REVIEW_REQUESTED -> {
        final JsonNode reviewer = node.path("requestedReviewer");
        // Team には login が無い
        put(
            attributes,
            "reviewer",
            reviewer.has("login") ? reviewer.path("login") : reviewer.path("name"));
      }
      case COMMITTED -> {
        final JsonNode commit = node.path("commit");
        final JsonNode committer = commit.path("committer");
        final String committerLogin = login(committer.path("user"));
        actor = committerLogin != null ? committerLogin : text(committer.path("name"));
        createdAt = timestamp(commit.path("committedDate"));
        put(attributes, "message_headline", commit.path("messageHeadline"));
        put(attributes, "abbreviated_oid", commit.path("abbreviatedOid"));
      }
      case SUBSCRIBED, MENTIONED -> {
        actor = null;
        createdAt = null;
      }
      case UNKNOWN -> attributes.put(TYPENAME, typename);
      default -> {
        // REOPENED, UNLOCKED, PINNED などは actor と時刻だけ
      }
    }
    return new TimelineEvent(kind, actor, createdAt, attributes);
  }

  private static void putSource(Map<String, String> attributes, JsonNode source) {
    if (source.isMissingNode() || source.isNull()) {
      return;
    }
    put(attributes, "source_type", source.path("__typename"));
    put(attributes, "source_number", source.path("number"));
    put(attributes, "source_title", source.path("title"));
  }

  private static void putRepository(Map<String, String> attributes, JsonNode repository) {
    final String owner = login(repository.path("owner"));
    final String name = text(repository.path("name"));
    if (owner != null && name != null) {
      attributes.put("repository", owner + "/" + name);
    }
  }

  private static void put(Map<String, String> attributes, String key, JsonNode value) {
    final String text = text(value);
    if (text != null && !text.isEmpty()) {
      attributes.put(key, text);
    }
  }

  private static String login(JsonNode actor) {
    return text(actor.path("login"));
  }

  private static String text(JsonNode value) {
    if (value == null || value.isMissingNode() || value.isNull()) {
      return null;
    }
    return value.asText();
  }

  private static Instant timestamp(JsonNode value) {
    return GithubTimestamps.parseOrNull(text(value));
  }
}
