/*
 * どこで: Inbox 設定
 * 何を: 認証済みの GitHub 呼び出し専用 RestClient を 1 つだけ提供する
 * なぜ: fetcher/resolver/coordinator で同じ接続設定と資格情報を共有するため
 */
package com.example.inbox.config;

import com.example.inbox.service.AuthenticationException;
import java.net.http.HttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(GithubClientProperties.class)
public class GithubClientConfig {

  static final String API_VERSION_HEADER = "X-GitHub-Api-Version";
  static final String API_VERSION = "2022-11-28";
  static final String GITHUB_JSON = "application/vnd.github+json";

  @Bean
  RestClient githubRestClient(RestClient.Builder builder, GithubClientProperties properties) {
    if (properties.token().isBlank()) {
      // トークン無しでは全 API が 401 になるので起動時に止める
      throw new AuthenticationException("github token is not configured (set GITHUB_TOKEN)");
    }
    // PATCH を送るため HttpURLConnection ベースではなく JDK HttpClient を使う
    final HttpClient httpClient =
        HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();
    final JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.token())
        .defaultHeader(HttpHeaders.ACCEPT, GITHUB_JSON)
        .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
        .defaultHeader(API_VERSION_HEADER, API_VERSION)
        .build();
  }
}
