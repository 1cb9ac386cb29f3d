package com.monotrack.config;

import com.monotrack.service.RequestThrottle;
import com.monotrack.service.RetryPolicy;
import com.monotrack.service.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class SyncConfig {
  private static final String DEFAULT_MONOBANK_URL = "https://api.monobank.ua";

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper sleeper() {
    return Sleeper.threadSleep();
  }

  @Bean(name = "syncExecutor", destroyMethod = "shutdown")
  public ExecutorService syncExecutor(SyncProperties properties) {
    int threads = Math.max(1, properties.userConcurrency());
    return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("sync-user-"));
  }

  @Bean("providerRetryPolicy")
  public RetryPolicy providerRetryPolicy(SyncProperties properties) {
    return RetryPolicy.from(properties.providerRetry());
  }

  @Bean("storeRetryPolicy")
  public RetryPolicy storeRetryPolicy(SyncProperties properties) {
    return RetryPolicy.from(properties.storeRetry());
  }

  @Bean
  public RequestThrottle requestThrottle(MonobankProperties properties, Clock clock, Sleeper sleeper) {
    return new RequestThrottle(properties.minRequestInterval(), clock, sleeper);
  }

  @Bean
  public RestClient monobankRestClient(RestClient.Builder builder, MonobankProperties properties) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(orDefault(properties.connectTimeout(), Duration.ofSeconds(10)));
    requestFactory.setReadTimeout(orDefault(properties.readTimeout(), Duration.ofSeconds(30)));
    String baseUrl = properties.baseUrl() == null || properties.baseUrl().isBlank()
        ? DEFAULT_MONOBANK_URL
        : properties.baseUrl();
    return builder.baseUrl(baseUrl).requestFactory(requestFactory).build();
  }

  private static Duration orDefault(Duration value, Duration fallback) {
    return value == null ? fallback : value;
  }
}
