package com.example.inbox.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.inbox.service.AuthenticationException;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

class GithubClientConfigTest {

  private final GithubClientConfig config = new GithubClientConfig();

  @Test
  void missingTokenStopsStartup() {
    final GithubClientProperties properties =
        new GithubClientProperties(null, "   ", null, null, null, null, null, null, null);

    assertThatThrownBy(() -> config.githubRestClient(RestClient.builder(), properties))
        .isInstanceOf(AuthenticationException.class)
        .hasMessageContaining("GITHUB_TOKEN");
  }

  @Test
  void configuredTokenBuildsClient() {
    final GithubClientProperties properties =
        new GithubClientProperties(
            "http://github.test", "ghp_test", null, null, null, null, null, null, null);

    assertThat(config.githubRestClient(RestClient.builder(), properties)).isNotNull();
  }
}
