/*
 * どこで: Digest Dispatch 並列制御
 * 何を: 同時実行数を上限 N に抑えてタスクを FIFO で開始する
 * なぜ: データストアや送信 API へ同時に張り付く接続数を制限するため
 */
package com.example.dispatch.concurrent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 上限付きの非同期タスク実行器。
 *
 * <p>失敗したタスクは自分の future だけを例外完了させ、待機中のタスクは引き続き開始される。
 */
public class ConcurrencyLimiter {

  private final int maxConcurrency;
  private final Executor executor;
  private final Deque<PendingTask<?>> queue = new ArrayDeque<>();
  private int running;

  public ConcurrencyLimiter(int maxConcurrency, Executor executor) {
    if (maxConcurrency <= 0) {
      throw new IllegalArgumentException("maxConcurrency must be positive");
    }
    this.maxConcurrency = maxConcurrency;
    this.executor = executor;
  }

  public <T> CompletableFuture<T> submit(Callable<T> task) {
    final PendingTask<T> pending = new PendingTask<>(task, new CompletableFuture<>());
    synchronized (this) {
      queue.addLast(pending);
    }
    drain();
    return pending.future();
  }

  public synchronized int running() {
    return running;
  }

  public synchronized int queued() {
    return queue.size();
  }

  private void drain() {
    while (true) {
      final PendingTask<?> next;
      synchronized (this) {
        if (running >= maxConcurrency || queue.isEmpty()) {
          return;
        }
        next = queue.pollFirst();
        running++;
      }
      start(next);
    }
  }

  private <T> void start(PendingTask<T> pending) {
    try {
      executor.execute(() -> runAndRelease(pending));
    } catch (RejectedExecutionException ex) {
      pending.future().completeExceptionally(ex);
      release();
    }
  }

  private <T> void runAndRelease(PendingTask<T> pending) {
    try {
      pending.future().complete(pending.task().call());
    } catch (Exception ex) {
      pending.future().completeExceptionally(ex);
    } catch (Error error) {
      pending.future().completeExceptionally(error);
      throw error;
    } finally {
      release();
    }
  }

  private void release() {
    synchronized (this) {
      running--;
    }
    drain();
  }

  private record PendingTask<T>(Callable<T> task, CompletableFuture<T> future) {}
}
