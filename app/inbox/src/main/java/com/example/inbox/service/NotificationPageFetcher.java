/*
 * どこで: Inbox サービス層
 * 何を: 通知一覧の全ページを取得し NotificationStub の列にする
 * なぜ: 1 ページ目で総ページ数を知り、残りを並列で取りに行くため
 */
package com.example.inbox.service;

import com.example.inbox.model.NotificationStub;
import com.example.inbox.model.NotificationSubject;
import com.example.inbox.model.RepoMeta;
import com.example.inbox.service.dto.NotificationPage;
import com.example.inbox.service.dto.NotificationThreadResponse;
import com.google.common.annotations.VisibleForTesting;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationPageFetcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationPageFetcher.class);

  private final GithubClient githubClient;
  private final BoundedFanOut fanOut;

  /** 全ページを取得する。1 ページでも失敗したら全体を失敗とし、部分結果は返さない。 */
  public List<NotificationStub> fetchAllStubs() {
    final NotificationPage first = fetchPage(1);
    final List<NotificationStub> stubs = new ArrayList<>(toStubs(first.items()));
    if (first.lastPage() <= 1) {
      return List.copyOf(stubs);
    }
    final List<Integer> remaining = IntStream.rangeClosed(2, first.lastPage()).boxed().toList();
    final List<BoundedFanOut.Outcome<Integer, NotificationPage>> outcomes =
        fanOut.runAll(remaining, this::fetchPageRaw);
    for (BoundedFanOut.Outcome<Integer, NotificationPage> outcome : outcomes) {
      if (outcome.failed()) {
        logger.warn("notification page fetch failed page={}", outcome.input(), outcome.error());
        throw new NotificationFetchException(
            "failed to fetch notification page " + outcome.input(), outcome.error());
      }
      stubs.addAll(toStubs(outcome.value().items()));
    }
    logger.info("fetched notification stubs pages={} count={}", first.lastPage(), stubs.size());
    return List.copyOf(stubs);
  }

  private NotificationPage fetchPage(int page) {
    try {
      return githubClient.listNotifications(page);
    } catch (GithubIntegrationException ex) {
      throw new NotificationFetchException("failed to fetch notification page " + page, ex);
    }
  }

  private NotificationPage fetchPageRaw(int page) {
    return githubClient.listNotifications(page);
  }

  private List<NotificationStub> toStubs(List<NotificationThreadResponse> threads) {
    final List<NotificationStub> stubs = new ArrayList<>(threads.size());
    for (NotificationThreadResponse thread : threads) {
      stubs.add(toStub(thread));
    }
    return stubs;
  }

  @VisibleForTesting
  static NotificationStub toStub(NotificationThreadResponse thread) {
    final NotificationThreadResponse.Subject subject = thread.subject();
    final NotificationThreadResponse.Repository repository = thread.repository();
    final RepoMeta repo =
        repository == null
            ? new RepoMeta("", "")
            : new RepoMeta(
                repository.owner() == null ? null : repository.owner().login(),
                repository.name());
    return new NotificationStub(
        thread.id(),
        thread.unread(),
        new NotificationSubject(
            subject.type(), subject.title(), subject.url(), subject.latestCommentUrl()),
        repo,
        parseInstant(thread.updatedAt()));
  }

  private static Instant parseInstant(String value) {
    try {
      return GithubTimestamps.parseOrNull(value);
    } catch (GithubIntegrationException ex) {
      throw new NotificationFetchException("invalid timestamp in notification: " + value, ex);
    }
  }
}
