package com.example.pairprog.controller;

import com.example.pairprog.autocomplete.AutocompleteService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AutocompleteControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new AutocompleteController(new AutocompleteService()))
                .setMessageConverters(new MappingJackson2HttpMessageConverter())
                .build();
    }

    @Test
    void suggestsKeywordSnippet() throws Exception {
        mockMvc.perform(post("/api/autocomplete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"de\",\"cursorPosition\":2,\"language\":\"python\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.suggestion", is("def function_name():\n    pass")))
                .andExpect(jsonPath("$.startPosition", is(0)))
                .andExpect(jsonPath("$.endPosition", is(2)))
                .andExpect(jsonPath("$.description", is("Suggested completion for 'def'")));
    }

    @Test
    void negativeCursor_is400() throws Exception {
        mockMvc.perform(post("/api/autocomplete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"x\",\"cursorPosition\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.ok", is(false)))
                .andExpect(jsonPath("$.message", containsString("cursorPosition")));
    }

    @Test
    void missingCode_is400() throws Exception {
        mockMvc.perform(post("/api/autocomplete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cursorPosition\":0}"))
                .andExpect(status().isBadRequest());
    }
}
