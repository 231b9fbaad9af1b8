package com.example.dispatch.retry;

/** 再試行対象の呼び出し。引数は 0 始まりの試行番号。 */
@FunctionalInterface
public interface RetryableCall<T> {

  T call(int attempt) throws Exception;
}
