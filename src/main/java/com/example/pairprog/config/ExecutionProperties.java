package com.example.pairprog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties("app.execution")
public class ExecutionProperties {

  /** Piston-compatible execute endpoint. */
  private String pistonUrl = "https://emkc.org/api/v2/piston/execute";

  /** Upper bound for one sandbox round trip (connect + read). */
  private Duration timeout = Duration.ofSeconds(30);

  private int compileTimeoutMs = 10_000;
  private int runTimeoutMs = 5_000;

  // --- getters/setters ---

  public String getPistonUrl() { return pistonUrl; }
  public void setPistonUrl(String pistonUrl) { this.pistonUrl = pistonUrl; }

  public Duration getTimeout() { return timeout; }
  public void setTimeout(Duration timeout) { this.timeout = timeout; }

  public int getCompileTimeoutMs() { return compileTimeoutMs; }
  public void setCompileTimeoutMs(int compileTimeoutMs) { this.compileTimeoutMs = compileTimeoutMs; }

  public int getRunTimeoutMs() { return runTimeoutMs; }
  public void setRunTimeoutMs(int runTimeoutMs) { this.runTimeoutMs = runTimeoutMs; }
}
