/*
 * どこで: Inbox ワーカー
 * 何を: パイプラインで起きた例外を UI 向けの PipelineError に変換する
 * なぜ: 例外の種類ごとの表示と致命度の判定を 1 か所に集めるため
 */
package com.example.inbox.worker;

import com.example.inbox.service.AuthenticationException;
import com.example.inbox.service.GithubIntegrationException;
import com.example.inbox.service.HydrationException;
import com.example.inbox.service.NoBrowsableUrlException;
import com.example.inbox.service.NotificationFetchException;
import com.example.inbox.service.TargetResolveException;
import com.example.inbox.service.UnsupportedTargetException;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class PipelineErrorMapper {

  public PipelineError map(Throwable error) {
    if (error instanceof AuthenticationException) {
      return new PipelineError(ErrorCategory.AUTHENTICATION, error.getMessage(), true);
    }
    // 認証とレート制限はどの層で包まれていても優先する
    final Optional<GithubIntegrationException> integration =
        GithubIntegrationException.findIn(error);
    if (integration.isPresent()) {
      final GithubIntegrationException.Reason reason = integration.get().reason();
      if (reason == GithubIntegrationException.Reason.UNAUTHORIZED) {
        return new PipelineError(
            ErrorCategory.AUTHENTICATION, "GitHub rejected the token; check GITHUB_TOKEN", true);
      }
      if (reason == GithubIntegrationException.Reason.RATE_LIMITED) {
        return new PipelineError(
            ErrorCategory.RATE_LIMITED, "GitHub rate limit exceeded; try again later", false);
      }
    }
    if (error instanceof NotificationFetchException) {
      return new PipelineError(ErrorCategory.FETCH, describe(error), false);
    }
    if (error instanceof TargetResolveException) {
      return new PipelineError(ErrorCategory.RESOLVE, describe(error), false);
    }
    if (error instanceof HydrationException hydration) {
      final ErrorCategory category =
          hydration.reason() == HydrationException.Reason.RESOLVE_FAILED
              ? ErrorCategory.HYDRATION
              : ErrorCategory.TASK_AGGREGATION;
      return new PipelineError(category, describe(error), false);
    }
    if (error instanceof NoBrowsableUrlException) {
      return new PipelineError(ErrorCategory.NO_BROWSABLE_URL, error.getMessage(), false);
    }
    if (error instanceof UnsupportedTargetException) {
      return new PipelineError(ErrorCategory.NO_DETAIL, error.getMessage(), false);
    }
    if (error instanceof GithubIntegrationException) {
      return new PipelineError(ErrorCategory.FETCH, describe(error), false);
    }
    return new PipelineError(ErrorCategory.UNEXPECTED, error.toString(), false);
  }

  private String describe(Throwable error) {
    final String message = error.getMessage();
    final Throwable cause = error.getCause();
    if (cause == null || cause.getMessage() == null || cause.getMessage().equals(message)) {
      return message;
    }
    return message + ": " + cause.getMessage();
  }
}
