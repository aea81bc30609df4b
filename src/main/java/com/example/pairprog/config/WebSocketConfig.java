package com.example.pairprog.config;

import com.example.pairprog.handler.CollabWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.*;

/**
 * Registers the room socket and applies one origin list to both the socket handshake and /api/**.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer, WebMvcConfigurer {

  private static final String[] ANY = {"*"};

  private final CollabWebSocketHandler handler;
  private final String socketPath;
  private final String[] origins;

  public WebSocketConfig(
      CollabWebSocketHandler handler,
      // room id is the last path segment
      @Value("${app.websocket.path:/ws/*}") String socketPath,
      @Value("${app.websocket.allowed-origins:http://localhost:3000,http://localhost:5173}") String allowedOrigins,
      @Value("${app.websocket.debug-open:false}") boolean debugOpen
  ) {
    this.handler = handler;
    this.socketPath = socketPath;
    this.origins = debugOpen ? ANY : toPatterns(allowedOrigins);
  }

  static String[] toPatterns(String csv) {
    Set<String> patterns = new LinkedHashSet<>();
    for (String raw : csv.split(",")) {
      String origin = raw.trim();
      if (origin.isEmpty()) continue;
      patterns.add(origin);
      // dev servers hop ports
      if (origin.startsWith("http://localhost")) {
        patterns.add("http://localhost:*");
        patterns.add("http://127.0.0.1:*");
      }
    }
    return patterns.isEmpty() ? ANY : patterns.toArray(new String[0]);
  }

  List<String> getOriginPatterns() {
    return List.of(origins);
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    registry.addHandler(handler, socketPath).setAllowedOriginPatterns(origins);
  }

  @Override
  public void addCorsMappings(@NonNull CorsRegistry registry) {
    registry.addMapping("/api/**")
        .allowedOriginPatterns(origins)
        .allowedMethods("GET", "POST", "OPTIONS")
        .allowedHeaders("*")
        .allowCredentials(true);
  }
}
