package com.example.pairprog.config;

import com.example.pairprog.model.RoomState;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties("app.collab")
public class CollabProperties {

  /** Chat lines kept per room (oldest evicted first). */
  private int chatHistoryLimit = RoomState.DEFAULT_CHAT_HISTORY_LIMIT;

  /** Delay before a code update is written to the room store; later updates in the window replace it. */
  private long persistDebounceMs = 250;

  /** A send stuck longer than this gets the connection dropped. */
  private int sendTimeLimitMs = 10_000;

  /** Bytes queued for one connection before it is dropped as too slow. */
  private int sendBufferSizeLimit = 512 * 1024;

  // --- getters/setters ---

  public int getChatHistoryLimit() { return chatHistoryLimit; }
  public void setChatHistoryLimit(int chatHistoryLimit) { this.chatHistoryLimit = chatHistoryLimit; }

  public long getPersistDebounceMs() { return persistDebounceMs; }
  public void setPersistDebounceMs(long persistDebounceMs) { this.persistDebounceMs = persistDebounceMs; }

  public int getSendTimeLimitMs() { return sendTimeLimitMs; }
  public void setSendTimeLimitMs(int sendTimeLimitMs) { this.sendTimeLimitMs = sendTimeLimitMs; }

  public int getSendBufferSizeLimit() { return sendBufferSizeLimit; }
  public void setSendBufferSizeLimit(int sendBufferSizeLimit) { this.sendBufferSizeLimit = sendBufferSizeLimit; }
}
