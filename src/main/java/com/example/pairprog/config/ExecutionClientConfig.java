package com.example.pairprog.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ExecutionClientConfig {

  private static final Logger log = LoggerFactory.getLogger(ExecutionClientConfig.class);

  @Bean
  public RestClient executionRestClient(RestClient.Builder builder, ExecutionProperties props) {
    int timeoutMs = (int) Math.max(1, props.getTimeout().toMillis());

    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(timeoutMs);
    factory.setReadTimeout(timeoutMs);

    log.info("Execution client -> {} (timeout={}ms)", props.getPistonUrl(), timeoutMs);
    return builder.requestFactory(factory).build();
  }
}
