/*
 * どこで: Inbox 設定のバリデーションテスト
 * 何を: GithubClientProperties の既定値と Bean Validation を検証する
 * なぜ: 不正なタイムアウトやページサイズを起動時に検出できるようにするため
 */
package com.example.inbox.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GithubClientPropertiesValidationTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void defaultsAreAppliedAndValid() {
    final GithubClientProperties properties =
        new GithubClientProperties(null, null, null, null, null, null, null, null, null);

    assertThat(validator.validate(properties)).isEmpty();
    assertThat(properties.baseUrl()).isEqualTo("https://api.github.com");
    assertThat(properties.token()).isEmpty();
    assertThat(properties.notificationsPath()).isEqualTo("/notifications");
    assertThat(properties.markReadPath()).isEqualTo("/notifications/threads/{threadId}");
    assertThat(properties.graphqlPath()).isEqualTo("/graphql");
    assertThat(properties.perPage()).isEqualTo(50);
    assertThat(properties.readTimeout()).isEqualTo(Duration.ofSeconds(20));
  }

  @Test
  void tokenIsTrimmed() {
    final GithubClientProperties properties =
        new GithubClientProperties(null, "  ghp_x \n", null, null, null, null, null, null, null);

    assertThat(properties.token()).isEqualTo("ghp_x");
  }

  @Test
  void validationFailsWhenReadTimeoutIsZero() {
    final GithubClientProperties properties =
        new GithubClientProperties(
            null, "t", null, null, null, null, null, null, Duration.ZERO);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void validationFailsWhenPerPageExceedsApiLimit() {
    final GithubClientProperties properties =
        new GithubClientProperties(null, "t", null, null, null, 51, null, null, null);

    assertThat(validator.validate(properties)).isNotEmpty();
  }
}
