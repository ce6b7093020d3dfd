/*
 * どこで: Inbox サービス層
 * 何を: GitHub の資格情報が無い/無効であることを表現する
 * なぜ: セッション全体を止めるべき致命的エラーを他の失敗と区別するため
 */
package com.example.inbox.service;

public class AuthenticationException extends RuntimeException {

  public AuthenticationException(String message) {
    super(message);
  }
}
