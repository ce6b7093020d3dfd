/*
 * どこで: Inbox コンソール
 * 何を: 標準入力の 1 行コマンドをパイプライン要求に変換し、応答を標準出力に書く
 * なぜ: 描画エンジン無しでもキャッシュとワーカーの公開インタフェースだけで操作できるようにするため
 */
package com.example.inbox.console;

import com.example.inbox.model.Notification;
import com.example.inbox.model.NotificationTarget;
import com.example.inbox.model.detail.DiscussionAnswer;
import com.example.inbox.model.detail.DiscussionDetail;
import com.example.inbox.model.detail.IssueDetail;
import com.example.inbox.model.detail.ItemDetail;
import com.example.inbox.model.detail.PullRequestDetail;
import com.example.inbox.model.detail.ReleaseDetail;
import com.example.inbox.model.detail.TimelineEvent;
import com.example.inbox.service.NotificationCache;
import com.example.inbox.worker.PipelineError;
import com.example.inbox.worker.PipelineRequest;
import com.example.inbox.worker.PipelineResponse;
import com.example.inbox.worker.PipelineWorker;
import com.google.common.annotations.VisibleForTesting;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "inbox.console.enabled", havingValue = "true", matchIfMissing = true)
public class InboxConsole implements CommandLineRunner {

  private static final Logger logger = LoggerFactory.getLogger(InboxConsole.class);
  private static final int DEFAULT_LIST_LIMIT = 20;
  private static final String HELP =
      String.join(
          System.lineSeparator(),
          "commands:",
          "  refresh         re-fetch the inbox",
          "  list [n]        show the first n notifications (default " + DEFAULT_LIST_LIMIT + ")",
          "  read <index>    mark the notification as read",
          "  url <index>     resolve the page to open in a browser",
          "  show <index>    load the timeline or discussion",
          "  help            show this help",
          "  quit            exit");

  private final PipelineWorker worker;
  private final NotificationCache cache;
  private final PrintStream out;

  public InboxConsole(PipelineWorker worker, NotificationCache cache) {
    this(worker, cache, System.out);
  }

  @VisibleForTesting
  InboxConsole(PipelineWorker worker, NotificationCache cache, PrintStream out) {
    this.worker = worker;
    this.cache = cache;
    this.out = out;
  }

  @Override
  public void run(String... args) {
    worker.addListener(response -> render(response).ifPresent(out::println));
    out.println("github inbox; type 'help' for commands");
    final BufferedReader reader =
        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    try {
      String line;
      while ((line = reader.readLine()) != null) {
        if (!execute(line)) {
          break;
        }
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read console input", ex);
    }
    logger.info("console closed");
  }

  /** 1 行を処理する。終了コマンドなら false。 */
  @VisibleForTesting
  boolean execute(String line) {
    final String[] parts = line.trim().split("\\s+");
    final String command = parts[0].toLowerCase(Locale.ROOT);
    final String argument = parts.length > 1 ? parts[1] : null;
    switch (command) {
      case "" -> {
        // 空行は無視
      }
      case "quit", "exit" -> {
        return false;
      }
      case "help" -> out.println(HELP);
      case "refresh" -> submit(new PipelineRequest.Refresh());
      case "list" -> list(argument);
      case "read" -> withNotification(argument, n -> new PipelineRequest.MarkAsRead(n.id()));
      case "url" -> withNotification(argument, n -> new PipelineRequest.ResolveOpenUrl(n.id()));
      case "show" -> withNotification(argument, n -> new PipelineRequest.OpenDetail(n.id()));
      default -> out.println("unknown command: " + command + " (try 'help')");
    }
    return true;
  }

  private void list(String argument) {
    final int limit = argument == null ? DEFAULT_LIST_LIMIT : parseIndex(argument).orElse(-1);
    if (limit < 0) {
      out.println("usage: list [n]");
      return;
    }
    final List<Notification> notifications = cache.snapshot();
    if (notifications.isEmpty()) {
      out.println(worker.isTaskInProgress() ? "loading..." : "inbox is empty");
      return;
    }
    for (int i = 0; i < Math.min(limit, notifications.size()); i++) {
      out.println(formatLine(i, notifications.get(i)));
    }
  }

  private void withNotification(
      String argument, Function<Notification, PipelineRequest> requestFactory) {
    final Optional<Notification> notification =
        parseIndex(argument).flatMap(index -> cache.get(index));
    if (notification.isEmpty()) {
      out.println("no notification at index " + argument);
      return;
    }
    submit(requestFactory.apply(notification.get()));
  }

  private void submit(PipelineRequest request) {
    if (!worker.submit(request)) {
      out.println("busy; try again later");
    }
  }

  @VisibleForTesting
  static String formatLine(int index, Notification notification) {
    final NotificationTarget target = notification.target();
    final OptionalLong targetNumber = target.numberIfPresent();
    final String number = targetNumber.isPresent() ? "#" + targetNumber.getAsLong() : "";
    return String.format(
        Locale.ROOT,
        "%3d %s %-12s %s%s: %s",
        index,
        notification.stub().unread() ? "*" : " ",
        target.kind().name().toLowerCase(Locale.ROOT),
        notification.stub().repository().name(),
        number,
        notification.stub().subject().title());
  }

  @VisibleForTesting
  static Optional<String> render(PipelineResponse response) {
    if (response instanceof PipelineResponse.TaskStarted started) {
      return Optional.of("[" + started.requestType() + "] running...");
    }
    if (response instanceof PipelineResponse.NotificationsReplaced replaced) {
      return Optional.of(replaced.notifications().size() + " notifications loaded");
    }
    if (response instanceof PipelineResponse.NotificationRemoved removed) {
      return Optional.of("marked as read: " + removed.id());
    }
    if (response instanceof PipelineResponse.OpenUrlResolved resolved) {
      return Optional.of(resolved.url());
    }
    if (response instanceof PipelineResponse.DetailLoaded loaded) {
      return Optional.of(renderDetail(loaded.detail()));
    }
    if (response instanceof PipelineResponse.OperationFailed failed) {
      final PipelineError error = failed.error();
      final String severity = error.fatal() ? " (fatal) " : " ";
      return Optional.of("error [" + error.category() + "]" + severity + error.message());
    }
    return Optional.empty();
  }

  private static String renderDetail(ItemDetail detail) {
    final StringBuilder builder = new StringBuilder();
    if (detail instanceof IssueDetail issue) {
      builder.append(issue.meta().title()).append(" [").append(issue.meta().state()).append(']');
      appendEvents(builder, issue.events());
    } else if (detail instanceof PullRequestDetail pr) {
      builder.append(pr.meta().title()).append(" [").append(pr.meta().state()).append(']');
      appendEvents(builder, pr.events());
    } else if (detail instanceof DiscussionDetail discussion) {
      builder
          .append(discussion.meta().title())
          .append(" [")
          .append(discussion.meta().state())
          .append("] by ")
          .append(discussion.author());
      for (DiscussionAnswer answer : discussion.answers()) {
        builder
            .append(System.lineSeparator())
            .append(answer.isAnswer() ? "  (answer) " : "  ")
            .append(answer.author())
            .append(" +")
            .append(answer.upvotes())
            .append(" replies=")
            .append(answer.replies().size());
      }
    } else if (detail instanceof ReleaseDetail release) {
      builder
          .append(release.meta().title())
          .append(" (")
          .append(release.meta().tagName())
          .append(')')
          .append(System.lineSeparator())
          .append(release.meta().body());
    } else {
      builder.append(detail.kind());
    }
    return builder.toString();
  }

  private static void appendEvents(StringBuilder builder, List<TimelineEvent> events) {
    for (TimelineEvent event : events) {
      builder
          .append(System.lineSeparator())
          .append("  ")
          .append(event.actor() == null ? "-" : event.actor())
          .append(' ')
          .append(event.kind().name().toLowerCase(Locale.ROOT));
    }
  }

  private static Optional<Integer> parseIndex(String argument) {
    if (argument == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Integer.parseInt(argument));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }
}
