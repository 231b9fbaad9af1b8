package com.example.dispatch.recipient;

/** 受信者一覧の取得に失敗したことを表す。配信ラン全体を中断させる。 */
public class RecipientDirectoryException extends RuntimeException {

  public RecipientDirectoryException(String message, Throwable cause) {
    super(message, cause);
  }
}
