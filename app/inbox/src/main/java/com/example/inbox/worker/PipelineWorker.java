/*
 * どこで: Inbox ワーカー
 * 何を: UI からの要求を 1 本のスレッドで順番に処理し、結果をリスナーへ返す
 * なぜ: 要求同士を並行させず、キャッシュの書き手を 1 つに保つため
 */
package com.example.inbox.worker;

import com.example.common.TraceIds;
import com.example.inbox.config.WorkerProperties;
import com.example.inbox.model.Notification;
import com.example.inbox.model.detail.ItemDetail;
import com.example.inbox.service.GithubIntegrationException;
import com.example.inbox.service.InboxMetrics;
import com.example.inbox.service.NotificationCoordinator;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "inbox.worker.enabled", havingValue = "true", matchIfMissing = true)
public class PipelineWorker implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(PipelineWorker.class);
  private static final String REQUEST_ID_KEY = "request_id";
  private static final String REQUEST_TYPE_KEY = "request_type";
  private static final long STOP_TIMEOUT_MILLIS = 5_000;

  private final NotificationCoordinator coordinator;
  private final PipelineErrorMapper errorMapper;
  private final InboxMetrics metrics;
  private final WorkerProperties properties;
  private final BlockingQueue<PipelineRequest> queue;
  private final List<PipelineResponseListener> listeners = new CopyOnWriteArrayList<>();
  // 受理済みで TaskFinished をまだ出していない要求の数
  private final AtomicInteger outstanding = new AtomicInteger();
  private volatile boolean running;
  private Thread thread;

  public PipelineWorker(
      NotificationCoordinator coordinator,
      PipelineErrorMapper errorMapper,
      InboxMetrics metrics,
      WorkerProperties properties) {
    this.coordinator = coordinator;
    this.errorMapper = errorMapper;
    this.metrics = metrics;
    this.properties = properties;
    this.queue = new LinkedBlockingQueue<>(properties.queueCapacity());
  }

  public void addListener(PipelineResponseListener listener) {
    listeners.add(listener);
  }

  public void removeListener(PipelineResponseListener listener) {
    listeners.remove(listener);
  }

  /** キューが満杯なら false を返し、要求は捨てられる。 */
  public boolean submit(PipelineRequest request) {
    outstanding.incrementAndGet();
    final boolean accepted = queue.offer(request);
    if (!accepted) {
      outstanding.decrementAndGet();
      logger.warn("pipeline queue is full; request dropped type={}", request.type());
      metrics.recordRequest(request.type(), "dropped");
    }
    return accepted;
  }

  /** キュー待ちを含め、受理済みの要求が 1 件でも残っていれば true。 */
  public boolean isTaskInProgress() {
    return outstanding.get() > 0;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    thread =
        new ThreadFactoryBuilder()
            .setNameFormat("inbox-worker-%d")
            .setDaemon(true)
            .build()
            .newThread(this::runLoop);
    thread.start();
    logger.info("pipeline worker started queueCapacity={}", properties.queueCapacity());
    if (properties.refreshOnStart()) {
      submit(new PipelineRequest.Refresh());
    }
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    thread.interrupt();
    try {
      thread.join(STOP_TIMEOUT_MILLIS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    logger.info("pipeline worker stopped pending={}", queue.size());
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  private void runLoop() {
    while (running) {
      final PipelineRequest request;
      try {
        request = queue.poll(1, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        if (running) {
          logger.warn("pipeline worker interrupted while running; exiting");
        }
        Thread.currentThread().interrupt();
        return;
      }
      if (request != null) {
        process(request);
      }
    }
  }

  /** 1 件処理する。例外はここで PipelineError に変換し、スレッドは止めない。 */
  @VisibleForTesting
  void process(PipelineRequest request) {
    MDC.put(REQUEST_ID_KEY, TraceIds.newShortId());
    MDC.put(REQUEST_TYPE_KEY, request.type());
    emit(new PipelineResponse.TaskStarted(request.type()));
    try {
      emit(handle(request));
      metrics.recordRequest(request.type(), "success");
    } catch (RuntimeException ex) {
      final PipelineError error = errorMapper.map(ex);
      GithubIntegrationException.findIn(ex)
          .ifPresent(integration -> metrics.recordGithubError(integration.reason()));
      metrics.recordRequest(request.type(), "failure");
      logger.warn(
          "pipeline request failed type={} category={} fatal={}",
          request.type(),
          error.category(),
          error.fatal(),
          ex);
      emit(new PipelineResponse.OperationFailed(error));
    } finally {
      outstanding.updateAndGet(count -> count > 0 ? count - 1 : 0);
      emit(new PipelineResponse.TaskFinished(request.type()));
      MDC.remove(REQUEST_ID_KEY);
      MDC.remove(REQUEST_TYPE_KEY);
    }
  }

  private PipelineResponse handle(PipelineRequest request) {
    if (request instanceof PipelineRequest.Refresh) {
      final List<Notification> notifications = coordinator.refresh();
      return new PipelineResponse.NotificationsReplaced(notifications);
    }
    if (request instanceof PipelineRequest.MarkAsRead markAsRead) {
      coordinator.markAsRead(markAsRead.id());
      return new PipelineResponse.NotificationRemoved(markAsRead.id());
    }
    if (request instanceof PipelineRequest.ResolveOpenUrl resolve) {
      final String url = coordinator.resolveOpenUrl(resolve.id());
      return new PipelineResponse.OpenUrlResolved(resolve.id(), url);
    }
    if (request instanceof PipelineRequest.OpenDetail openDetail) {
      final ItemDetail detail = coordinator.openDetail(openDetail.id());
      return new PipelineResponse.DetailLoaded(detail);
    }
    throw new IllegalArgumentException("unsupported pipeline request " + request.type());
  }

  private void emit(PipelineResponse response) {
    for (PipelineResponseListener listener : listeners) {
      try {
        listener.onResponse(response);
      } catch (RuntimeException ex) {
        logger.warn(
            "pipeline response listener failed response={}",
            response.getClass().getSimpleName(),
            ex);
      }
    }
  }
}
