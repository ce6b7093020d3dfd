/*
 * どこで: Inbox サービス層
 * 何を: 表示用の Notification 一覧を保持する
 * なぜ: 書き込みはワーカーだけ、読み取りは UI スレッドからロック無しで行えるようにするため
 */
package com.example.inbox.service;

import com.example.inbox.model.Notification;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** コピーオンライト。読み取り側は volatile な不変リストを見るだけでブロックしない。 */
@Component
@RequiredArgsConstructor
public class NotificationCache {

  private final InboxMetrics metrics;
  private final ReentrantLock writeLock = new ReentrantLock();
  private volatile List<Notification> notifications = List.of();

  /** 一覧を丸ごと差し替える。id が重複した場合は先に現れたものを残す。 */
  public void replace(List<Notification> replacement) {
    final List<Notification> deduplicated = new ArrayList<>(replacement.size());
    final Set<String> seen = new HashSet<>();
    for (Notification notification : replacement) {
      if (seen.add(notification.id())) {
        deduplicated.add(notification);
      }
    }
    writeLock.lock();
    try {
      notifications = List.copyOf(deduplicated);
      metrics.updateCacheSize(notifications.size());
    } finally {
      writeLock.unlock();
    }
  }

  /** id が無ければ何もしない。削除したら true。 */
  public boolean remove(String id) {
    writeLock.lock();
    try {
      final List<Notification> current = notifications;
      final List<Notification> next =
          current.stream().filter(notification -> !notification.id().equals(id)).toList();
      if (next.size() == current.size()) {
        return false;
      }
      notifications = next;
      metrics.updateCacheSize(next.size());
      return true;
    } finally {
      writeLock.unlock();
    }
  }

  public List<Notification> snapshot() {
    return notifications;
  }

  public Optional<Notification> get(int index) {
    final List<Notification> current = notifications;
    if (index < 0 || index >= current.size()) {
      return Optional.empty();
    }
    return Optional.of(current.get(index));
  }

  public Optional<Notification> find(String id) {
    return notifications.stream().filter(notification -> notification.id().equals(id)).findFirst();
  }

  public int size() {
    return notifications.size();
  }
}
