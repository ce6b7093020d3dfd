/*
 * どこで: Inbox サービス層
 * 何を: refresh / 既読化 / ブラウザ URL 解決 / 詳細ロードをキャッシュと GitHub の間で調停する
 * なぜ: リモートが成功したときだけキャッシュを書き換え、失敗時は前の状態を残すため
 */
package com.example.inbox.service;

import com.example.inbox.model.IssueMeta;
import com.example.inbox.model.Notification;
import com.example.inbox.model.NotificationStub;
import com.example.inbox.model.NotificationTarget;
import com.example.inbox.model.PullRequestMeta;
import com.example.inbox.model.ReleaseMeta;
import com.example.inbox.model.TargetKind;
import com.example.inbox.model.detail.ItemDetail;
import com.example.inbox.service.dto.CommentResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(NotificationCoordinator.class);

  private final NotificationPageFetcher fetcher;
  private final NotificationHydrator hydrator;
  private final NotificationCache cache;
  private final GithubClient githubClient;
  private final ItemDetailService itemDetailService;
  private final InboxMetrics metrics;
  private final Clock clock;

  /** 取得と hydration が両方成功したときだけキャッシュを差し替える。 */
  public List<Notification> refresh() {
    final Instant startedAt = clock.instant();
    final List<NotificationStub> stubs = fetcher.fetchAllStubs();
    final List<Notification> hydrated = hydrator.hydrate(stubs);
    cache.replace(hydrated);
    metrics.recordRefreshDuration(Duration.between(startedAt, clock.instant()));
    logger.info("notification cache refreshed count={}", cache.size());
    return cache.snapshot();
  }

  /**
   * スレッドを既読にし、成功したらキャッシュから外す。
   *
   * @throws NotificationFetchException リモート呼び出しが失敗した場合。キャッシュは変更しない
   */
  public void markAsRead(String id) {
    try {
      githubClient.markThreadAsRead(id);
    } catch (GithubIntegrationException ex) {
      logger.warn("mark as read failed id={} reason={}", id, ex.reason());
      throw new NotificationFetchException("failed to mark notification " + id + " as read", ex);
    }
    final boolean removed = cache.remove(id);
    logger.info("notification marked as read id={} removedFromCache={}", id, removed);
  }

  /**
   * ブラウザで開く URL を決める。PullRequest は最新コメントではなく PR 本体を開く。
   *
   * @throws NoBrowsableUrlException キャッシュに無い、または開ける URL を持たない種別の場合
   */
  public String resolveOpenUrl(String id) {
    final Notification notification =
        cache
            .find(id)
            .orElseThrow(
                () -> new NoBrowsableUrlException(id, "notification is not cached id=" + id));
    final NotificationTarget target = notification.target();
    final String url;
    if (target instanceof ReleaseMeta release) {
      url = release.htmlUrl();
    } else if (target instanceof IssueMeta issue) {
      url = latestCommentUrl(notification).orElse(issue.htmlUrl());
    } else if (target instanceof PullRequestMeta pr) {
      url = pr.htmlUrl();
    } else {
      throw new NoBrowsableUrlException(
          id, "no browsable url for " + target.kind() + " notification id=" + id);
    }
    if (url == null || url.isBlank()) {
      throw new NoBrowsableUrlException(id, "html url is missing id=" + id);
    }
    return url;
  }

  /**
   * 詳細ビューを読み込む。
   *
   * @throws UnsupportedTargetException キャッシュに無い、または詳細ビューを持たない種別の場合
   */
  public ItemDetail openDetail(String id) {
    final Notification notification =
        cache
            .find(id)
            .orElseThrow(
                () ->
                    new UnsupportedTargetException(
                        TargetKind.UNKNOWN, "notification is not cached id=" + id));
    return itemDetailService.load(notification);
  }

  private Optional<String> latestCommentUrl(Notification notification) {
    final Optional<String> apiUrl = notification.stub().subject().latestCommentUrlIfPresent();
    if (apiUrl.isEmpty()) {
      return Optional.empty();
    }
    try {
      final CommentResponse comment = githubClient.getDetail(apiUrl.get(), CommentResponse.class);
      return Optional.ofNullable(comment.htmlUrl()).filter(url -> !url.isBlank());
    } catch (GithubIntegrationException ex) {
      throw new NotificationFetchException(
          "failed to fetch latest comment for notification " + notification.id(), ex);
    }
  }
}
