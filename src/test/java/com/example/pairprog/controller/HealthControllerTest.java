package com.example.pairprog.controller;

import com.example.pairprog.handler.CollabWebSocketHandler;
import com.example.pairprog.service.RoomRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class HealthControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        RoomRegistry registry = mock(RoomRegistry.class);
        CollabWebSocketHandler sockets = mock(CollabWebSocketHandler.class);
        when(registry.hotRoomCount()).thenReturn(3);
        when(sockets.openConnections()).thenReturn(5);

        HealthController controller = new HealthController(registry, sockets);
        ReflectionTestUtils.setField(controller, "appName", "pairprog");
        ReflectionTestUtils.setField(controller, "version", "1.0.0");

        mockMvc = MockMvcBuilders
                .standaloneSetup(controller)
                .setMessageConverters(new StringHttpMessageConverter(), new MappingJackson2HttpMessageConverter())
                .build();
    }

    @Test
    void healthz_isPlainOk() throws Exception {
        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(content().string("ok"));
    }

    @Test
    void root_reportsAppAndVersion() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("healthy")))
                .andExpect(jsonPath("$.app", is("pairprog")))
                .andExpect(jsonPath("$.version", is("1.0.0")));
    }

    @Test
    void health_reportsLiveCounts() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.websocket", is("ready")))
                .andExpect(jsonPath("$.hotRooms", is(3)))
                .andExpect(jsonPath("$.connections", is(5)));
    }
}
