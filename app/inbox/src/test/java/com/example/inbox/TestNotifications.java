package com.example.inbox;

import com.example.inbox.model.IssueMeta;
import com.example.inbox.model.IssueState;
import com.example.inbox.model.Notification;
import com.example.inbox.model.NotificationStub;
import com.example.inbox.model.NotificationSubject;
import com.example.inbox.model.NotificationTarget;
import com.example.inbox.model.RepoMeta;
import com.example.inbox.service.dto.GithubUserResponse;
import com.example.inbox.service.dto.NotificationThreadResponse;
import java.time.Instant;

/** テスト用の通知データ。 */
public final class TestNotifications {

  public static final RepoMeta REPO = new RepoMeta("octo", "inbox");

  private TestNotifications() {}

  public static NotificationStub stub(String id, String type, String updatedAt) {
    return new NotificationStub(
        id,
        true,
        new NotificationSubject(
            type,
            "title " + id,
            "https://api.github.test/repos/octo/inbox/items/" + id,
            null),
        REPO,
        Instant.parse(updatedAt));
  }

  public static NotificationStub stub(String id, NotificationSubject subject) {
    return new NotificationStub(id, true, subject, REPO, Instant.parse("2026-01-01T00:00:00Z"));
  }

  public static Notification notification(String id, String updatedAt) {
    return new Notification(stub(id, "Issue", updatedAt), issue(Long.parseLong(id)));
  }

  public static Notification notification(NotificationStub stub, NotificationTarget target) {
    return new Notification(stub, target);
  }

  public static IssueMeta issue(long number) {
    return new IssueMeta(
        REPO,
        "issue " + number,
        "body",
        number,
        "alice",
        IssueState.OPEN,
        null,
        Instant.parse("2026-01-01T00:00:00Z"),
        "https://github.test/octo/inbox/issues/" + number);
  }

  public static NotificationThreadResponse thread(String id, String type, String updatedAt) {
    return new NotificationThreadResponse(
        id,
        true,
        updatedAt,
        new NotificationThreadResponse.Subject(
            "title " + id, "https://api.github.test/repos/octo/inbox/issues/" + id, null, type),
        new NotificationThreadResponse.Repository(
            "inbox", "octo/inbox", new GithubUserResponse("octo")),
        "https://api.github.test/notifications/threads/" + id);
  }
}
