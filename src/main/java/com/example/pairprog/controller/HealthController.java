package com.example.pairprog.controller;

import com.example.pairprog.handler.CollabWebSocketHandler;
import com.example.pairprog.service.RoomRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final RoomRegistry registry;
  private final CollabWebSocketHandler sockets;

  @Value("${spring.application.name:pairprog}")
  private String appName;

  @Value("${app.version:1.0.0}")
  private String version;

  public HealthController(RoomRegistry registry, CollabWebSocketHandler sockets) {
    this.registry = registry;
    this.sockets = sockets;
  }

  /** Liveness probe, no DB */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", "healthy");
    m.put("app", appName);
    m.put("version", version);
    return m;
  }

  /** Human-readable status of the live side */
  @GetMapping("/health")
  public Map<String, Object> health() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", "healthy");
    m.put("websocket", "ready");
    m.put("hotRooms", registry.hotRoomCount());
    m.put("connections", sockets.openConnections());
    return m;
  }
}
