package com.example.tokenrelay.config;

import com.example.tokenrelay.properties.ApplicationProperties;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp Client Configuration
 *
 * Shared connection pool and dispatcher for calls to the authentication server
 */
@Configuration(proxyBeanMethods = false)
public class HttpClientConfig {

  /**
   * Shared connection pool to reduce connection establishment overhead
   */
  @Bean
  public ConnectionPool sharedConnectionPool(ApplicationProperties properties) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new ConnectionPool(client.maxIdleConnections(), client.keepAliveDurationMinutes(),
                              TimeUnit.MINUTES);
  }

  /**
   * Shared dispatcher for concurrent request management
   */
  @Bean
  public Dispatcher sharedDispatcher(ApplicationProperties properties) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(client.maxRequests());
    dispatcher.setMaxRequestsPerHost(client.maxRequestsPerHost());
    return dispatcher;
  }

  /**
   * Client for the authentication server. Bounded timeouts, no retries: a failed exchange
   * surfaces to the caller as an unknown error.
   */
  @Bean
  public OkHttpClient authServerOkHttpClient(ApplicationProperties properties,
                                             ConnectionPool connectionPool,
                                             Dispatcher dispatcher) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .dispatcher(dispatcher)
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(client.connectTimeout())
        .readTimeout(client.readTimeout())
        .writeTimeout(client.writeTimeout())
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }
}
