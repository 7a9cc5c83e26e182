package com.relay.notification.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.notification.engine.ContextScorer;
import com.relay.notification.model.FatigueIndicators;
import com.relay.notification.model.NotificationCategory;
import com.relay.notification.model.NotificationType;
import com.relay.notification.model.UserBehaviorPattern;
import com.relay.notification.service.FilterPipeline;
import com.relay.notification.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BehaviorController.class)
class BehaviorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private FilterPipeline filterPipeline;

    @MockBean
    private ContextScorer contextScorer;

    private final UserBehaviorPattern pattern = UserBehaviorPattern.builder()
            .userId("user-1")
            .preferredHours(List.of(9, 14))
            .preferredCategories(List.of(NotificationCategory.WORKFLOW))
            .fatigueIndicators(new FatigueIndicators(12, 600000.0, 0L))
            .build();

    @Test
    void analyze_success() throws Exception {
        when(contextScorer.analyzeBehavior(eq("user-1"), anyList())).thenReturn(pattern);

        mockMvc.perform(post("/api/v1/behavior/user-1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                TestDataFactory.createHistory(3, NotificationCategory.WORKFLOW, NotificationType.ERROR, 60_000L))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("user-1"))
                .andExpect(jsonPath("$.preferredCategories[0]").value("workflow"))
                .andExpect(jsonPath("$.fatigueIndicators.recentNotificationCount").value(12));

        verify(filterPipeline, never()).getCachedBehavior(any());
    }

    @Test
    void analyze_invalidHistoryEntry_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/behavior/user-1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"type\":\"error\",\"category\":\"workflow\",\"priority\":\"low\"}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("history[0].id"));
    }

    @Test
    void getCached_present() throws Exception {
        when(filterPipeline.getCachedBehavior("user-1")).thenReturn(Optional.of(pattern));

        mockMvc.perform(get("/api/v1/behavior/user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.preferredHours[1]").value(14));
    }

    @Test
    void getCached_absent_returns404() throws Exception {
        when(filterPipeline.getCachedBehavior("user-2")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/behavior/user-2"))
                .andExpect(status().isNotFound());
    }

    @Test
    void clearUser_noContent() throws Exception {
        mockMvc.perform(delete("/api/v1/behavior/cache/user-1"))
                .andExpect(status().isNoContent());

        verify(filterPipeline).clearBehaviorCache("user-1");
    }

    @Test
    void clearAll_noContent() throws Exception {
        mockMvc.perform(delete("/api/v1/behavior/cache"))
                .andExpect(status().isNoContent());

        verify(filterPipeline).clearBehaviorCache(null);
    }
}
