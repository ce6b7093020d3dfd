/*
 * どこで: Inbox ワーカー
 * 何を: ワーカーから UI へ返す応答とタスク開始/終了の通知を表す
 * なぜ: UI が受け取るイベントを 1 つの型にまとめるため
 */
package com.example.inbox.worker;

import com.example.inbox.model.Notification;
import com.example.inbox.model.detail.ItemDetail;
import java.util.List;

/** ワーカーから UI へ返す通知。 */
public interface PipelineResponse {

  record TaskStarted(String requestType) implements PipelineResponse {}

  record TaskFinished(String requestType) implements PipelineResponse {}

  record NotificationsReplaced(List<Notification> notifications) implements PipelineResponse {
    public NotificationsReplaced {
      notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }
  }

  record NotificationRemoved(String id) implements PipelineResponse {}

  record OpenUrlResolved(String id, String url) implements PipelineResponse {}

  record DetailLoaded(ItemDetail detail) implements PipelineResponse {}

  record OperationFailed(PipelineError error) implements PipelineResponse {}
}
