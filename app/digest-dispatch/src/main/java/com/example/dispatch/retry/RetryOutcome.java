package com.example.dispatch.retry;

/**
 * リトライ実行結果。
 *
 * @param attempt 成功または最後に失敗した試行の 0 始まり番号
 * @param attempts 実際に呼び出した回数
 */
public record RetryOutcome<T>(
    boolean success, T value, Throwable error, int attempt, int attempts) {

  public static <T> RetryOutcome<T> succeeded(T value, int attempt) {
    return new RetryOutcome<>(true, value, null, attempt, attempt + 1);
  }

  public static <T> RetryOutcome<T> failed(Throwable error, int attempt) {
    return new RetryOutcome<>(false, null, error, attempt, attempt + 1);
  }
}
