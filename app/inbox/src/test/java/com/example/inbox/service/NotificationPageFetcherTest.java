package com.example.inbox.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.inbox.TestNotifications;
import com.example.inbox.model.NotificationStub;
import com.example.inbox.service.dto.NotificationPage;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationPageFetcherTest {

  private ExecutorService executor;
  private GithubClient githubClient;
  private NotificationPageFetcher fetcher;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
    githubClient = mock(GithubClient.class);
    fetcher = new NotificationPageFetcher(githubClient, new BoundedFanOut(executor));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void singlePageIsFetchedOnce() {
    when(githubClient.listNotifications(1))
        .thenReturn(
            new NotificationPage(
                List.of(TestNotifications.thread("1", "Issue", "2026-01-01T00:00:00Z")), 1));

    final List<NotificationStub> stubs = fetcher.fetchAllStubs();

    assertThat(stubs).extracting(NotificationStub::id).containsExactly("1");
    verify(githubClient, never()).listNotifications(2);
  }

  @Test
  void remainingPagesAreFetchedAndConcatenated() {
    when(githubClient.listNotifications(1))
        .thenReturn(
            new NotificationPage(
                List.of(TestNotifications.thread("1", "Issue", "2026-01-01T00:00:00Z")), 3));
    when(githubClient.listNotifications(2))
        .thenReturn(
            new NotificationPage(
                List.of(TestNotifications.thread("2", "PullRequest", "2026-01-02T00:00:00Z")), 3));
    when(githubClient.listNotifications(3))
        .thenReturn(
            new NotificationPage(
                List.of(TestNotifications.thread("3", "Release", "2026-01-03T00:00:00Z")), 3));

    final List<NotificationStub> stubs = fetcher.fetchAllStubs();

    assertThat(stubs).extracting(NotificationStub::id).containsExactlyInAnyOrder("1", "2", "3");
  }

  @Test
  void anyPageFailureFailsWholeFetch() {
    when(githubClient.listNotifications(1))
        .thenReturn(
            new NotificationPage(
                List.of(TestNotifications.thread("1", "Issue", "2026-01-01T00:00:00Z")), 3));
    when(githubClient.listNotifications(2))
        .thenReturn(
            new NotificationPage(
                List.of(TestNotifications.thread("2", "Issue", "2026-01-02T00:00:00Z")), 3));
    when(githubClient.listNotifications(3))
        .thenThrow(
            new GithubIntegrationException(
                GithubIntegrationException.Reason.BAD_GATEWAY, "github server error"));

    assertThatThrownBy(() -> fetcher.fetchAllStubs())
        .isInstanceOf(NotificationFetchException.class)
        .hasMessageContaining("page 3")
        .hasCauseInstanceOf(GithubIntegrationException.class);
  }

  @Test
  void firstPageFailureIsFetchError() {
    when(githubClient.listNotifications(1))
        .thenThrow(
            new GithubIntegrationException(
                GithubIntegrationException.Reason.UNAUTHORIZED, "github rejected the token"));

    assertThatThrownBy(() -> fetcher.fetchAllStubs())
        .isInstanceOf(NotificationFetchException.class)
        .hasCauseInstanceOf(GithubIntegrationException.class);
  }

  @Test
  void toStubMapsRepositoryAndTimestamp() {
    final NotificationStub stub =
        NotificationPageFetcher.toStub(
            TestNotifications.thread("9", "Discussion", "2026-02-03T04:05:06Z"));

    assertThat(stub.id()).isEqualTo("9");
    assertThat(stub.unread()).isTrue();
    assertThat(stub.subject().type()).isEqualTo("Discussion");
    assertThat(stub.repository().fullName()).isEqualTo("octo/inbox");
    assertThat(stub.lastUpdatedAt()).isEqualTo(Instant.parse("2026-02-03T04:05:06Z"));
  }

  @Test
  void malformedTimestampIsFetchError() {
    when(githubClient.listNotifications(1))
        .thenReturn(
            new NotificationPage(
                List.of(TestNotifications.thread("1", "Issue", "yesterday")), 1));

    assertThatThrownBy(() -> fetcher.fetchAllStubs())
        .isInstanceOf(NotificationFetchException.class)
        .hasMessageContaining("yesterday");
  }
}
