/*
 * どこで: Inbox サービス層
 * 何を: 共有スレッドプールでタスクを並列実行し、全件の完了を待って結果を集める
 * なぜ: ページ取得と通知解決の同時実行数をプールサイズで上限管理するため
 */
package com.example.inbox.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class BoundedFanOut {

  private final ExecutorService fanOutExecutor;

  public BoundedFanOut(@Qualifier("fanOutExecutor") ExecutorService fanOutExecutor) {
    this.fanOutExecutor = fanOutExecutor;
  }

  /**
   * 入力ごとに 1 タスクを投入し、全タスクの終了を待つ。
   *
   * <p>途中で失敗があっても残りのタスクは最後まで待ち、入力と同じ順序の {@link Outcome} を返す。
   */
  public <I, O> List<Outcome<I, O>> runAll(List<I> inputs, Function<I, O> task) {
    final List<CompletableFuture<O>> futures = new ArrayList<>(inputs.size());
    for (I input : inputs) {
      futures.add(submit(input, task));
    }
    final List<Outcome<I, O>> outcomes = new ArrayList<>(inputs.size());
    for (int i = 0; i < inputs.size(); i++) {
      outcomes.add(await(inputs.get(i), futures.get(i)));
    }
    return outcomes;
  }

  private <I, O> CompletableFuture<O> submit(I input, Function<I, O> task) {
    try {
      return CompletableFuture.supplyAsync(() -> task.apply(input), fanOutExecutor);
    } catch (RejectedExecutionException ex) {
      return CompletableFuture.failedFuture(ex);
    }
  }

  private <I, O> Outcome<I, O> await(I input, CompletableFuture<O> future) {
    try {
      return Outcome.success(input, future.join());
    } catch (CompletionException ex) {
      return Outcome.failure(input, ex.getCause() == null ? ex : ex.getCause());
    } catch (CancellationException ex) {
      return Outcome.failure(input, ex);
    }
  }

  /** 1 タスクの結果。{@code error} が非 null なら失敗。 */
  public record Outcome<I, O>(I input, O value, Throwable error) {

    static <I, O> Outcome<I, O> success(I input, O value) {
      return new Outcome<>(input, value, null);
    }

    static <I, O> Outcome<I, O> failure(I input, Throwable error) {
      return new Outcome<>(input, null, error);
    }

    public boolean failed() {
      return error != null;
    }
  }
}
