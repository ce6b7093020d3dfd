/*
 * どこで: Inbox サービス層
 * 何を: stub ごとに TargetResolver を並列実行し、結果を新しい順に並べた Notification 列にする
 * なぜ: 解決失敗をどう扱うか(全体失敗/Unknown へ縮退)を 1 か所で決めるため
 */
package com.example.inbox.service;

import com.example.inbox.config.HydrationFailurePolicy;
import com.example.inbox.config.HydrationProperties;
import com.example.inbox.model.Notification;
import com.example.inbox.model.NotificationStub;
import com.example.inbox.model.NotificationTarget;
import com.example.inbox.model.SubjectType;
import com.example.inbox.model.UnknownTarget;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationHydrator {

  private static final Logger logger = LoggerFactory.getLogger(NotificationHydrator.class);

  static final Comparator<Notification> NEWEST_FIRST =
      Comparator.comparing((Notification notification) -> notification.stub().lastUpdatedAt())
          .reversed();

  private final TargetResolver targetResolver;
  private final BoundedFanOut fanOut;
  private final HydrationProperties properties;
  private final InboxMetrics metrics;

  /**
   * 全 stub を解決し、lastUpdatedAt の降順に安定ソートして返す。
   *
   * @throws HydrationException ABORT で 1 件でも失敗した場合、または DEGRADE でも認証/レート制限で失敗した場合
   */
  public List<Notification> hydrate(List<NotificationStub> stubs) {
    final List<BoundedFanOut.Outcome<NotificationStub, NotificationTarget>> outcomes =
        fanOut.runAll(stubs, targetResolver::resolve);

    final List<BoundedFanOut.Outcome<NotificationStub, NotificationTarget>> failures =
        new ArrayList<>();
    for (BoundedFanOut.Outcome<NotificationStub, NotificationTarget> outcome : outcomes) {
      if (outcome.failed()) {
        metrics.recordResolve(subjectTag(outcome.input()), "failure");
        failures.add(outcome);
      } else {
        metrics.recordResolve(outcome.value().kind().name().toLowerCase(Locale.ROOT), "success");
      }
    }
    if (!failures.isEmpty()
        && (properties.failurePolicy() == HydrationFailurePolicy.ABORT
            || hasSessionWideFailure(failures))) {
      throw aggregate(failures, stubs.size());
    }

    // 入力順を保ったまま組み立てる。同時刻の並びは取得順で決まる
    final List<Notification> hydrated = new ArrayList<>(stubs.size());
    for (BoundedFanOut.Outcome<NotificationStub, NotificationTarget> outcome : outcomes) {
      if (outcome.failed()) {
        logger.warn(
            "notification degraded to unknown id={}", outcome.input().id(), outcome.error());
        hydrated.add(new Notification(outcome.input(), UnknownTarget.INSTANCE));
      } else {
        hydrated.add(new Notification(outcome.input(), outcome.value()));
      }
    }

    // List.sort は安定ソート
    hydrated.sort(NEWEST_FIRST);
    return List.copyOf(hydrated);
  }

  private HydrationException aggregate(
      List<BoundedFanOut.Outcome<NotificationStub, NotificationTarget>> failures, int total) {
    final List<String> failedIds = failures.stream().map(f -> f.input().id()).toList();
    final boolean allResolveErrors =
        failures.stream().allMatch(f -> f.error() instanceof TargetResolveException);
    final HydrationException.Reason reason =
        allResolveErrors
            ? HydrationException.Reason.RESOLVE_FAILED
            : HydrationException.Reason.TASK_FAILED;
    final Throwable first = failures.get(0).error();
    final HydrationException exception =
        new HydrationException(
            reason,
            failures.size() + " of " + total + " notifications failed to hydrate",
            failedIds,
            first);
    for (int i = 1; i < failures.size(); i++) {
      exception.addSuppressed(failures.get(i).error());
    }
    logger.warn("hydration aborted reason={} failedIds={}", reason, failedIds, first);
    return exception;
  }

  /** 認証とレート制限は他の stub も同じ理由で失敗するので縮退しない。 */
  private boolean hasSessionWideFailure(
      List<BoundedFanOut.Outcome<NotificationStub, NotificationTarget>> failures) {
    return failures.stream()
        .map(f -> GithubIntegrationException.findIn(f.error()))
        .flatMap(Optional::stream)
        .anyMatch(
            ex ->
                ex.reason() == GithubIntegrationException.Reason.UNAUTHORIZED
                    || ex.reason() == GithubIntegrationException.Reason.RATE_LIMITED);
  }

  private String subjectTag(NotificationStub stub) {
    return SubjectType.classify(stub.subject().type()).name().toLowerCase(Locale.ROOT);
  }
}
