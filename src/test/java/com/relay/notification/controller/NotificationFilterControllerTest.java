package com.relay.notification.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.notification.engine.ContextScorer;
import com.relay.notification.engine.RuleFilter;
import com.relay.notification.exception.PredictionException;
import com.relay.notification.model.*;
import com.relay.notification.service.FilterPipeline;
import com.relay.notification.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(NotificationFilterController.class)
class NotificationFilterControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private FilterPipeline filterPipeline;

    @MockBean
    private RuleFilter ruleFilter;

    @MockBean
    private ContextScorer contextScorer;

    @MockBean
    private Clock clock;

    private final Notification notification = TestDataFactory.createNotification("N-1",
            NotificationPriority.CRITICAL, NotificationCategory.WORKFLOW, NotificationType.ERROR);

    // ── Filter ──

    @Test
    void filter_success() throws Exception {
        PipelineResult result = PipelineResult.builder()
                .notifications(List.of(notification))
                .statistics(new PipelineStatistics(1, 1, 1.0, 1.0))
                .mode(FilterMode.FULL)
                .completedStage(PipelineStage.EXPLAIN)
                .build();
        when(filterPipeline.filter(anyList(), any(), isNull())).thenReturn(result);

        mockMvc.perform(post("/api/v1/notifications/filter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new FilterRequest(List.of(notification), null, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notifications[0].id").value("N-1"))
                .andExpect(jsonPath("$.notifications[0].priority").value("critical"))
                .andExpect(jsonPath("$.statistics.inclusionRate").value(1.0))
                .andExpect(jsonPath("$.mode").value("FULL"))
                .andExpect(jsonPath("$.completedStage").value("explain"));
    }

    @Test
    void filter_timeoutGiven_deadlineFromClock() throws Exception {
        when(clock.instant()).thenReturn(TestDataFactory.NOW);
        when(filterPipeline.filter(anyList(), any(), any())).thenReturn(new PipelineResult());

        mockMvc.perform(post("/api/v1/notifications/filter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new FilterRequest(List.of(notification), null, 200L))))
                .andExpect(status().isOk());

        verify(filterPipeline).filter(anyList(), any(), eq(TestDataFactory.NOW.plusMillis(200)));
    }

    @Test
    void filter_nonPositiveTimeout_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/notifications/filter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new FilterRequest(List.of(notification), null, 0L))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("timeoutMs"));

        verifyNoInteractions(filterPipeline);
    }

    @Test
    void filter_missingNotifications_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/notifications/filter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("notifications is required"));
    }

    @Test
    void filter_notificationWithoutPriority_returns400WithField() throws Exception {
        String body = """
                {"notifications":[{"id":"N-1","type":"error","category":"workflow","createdAt":0}]}
                """;

        mockMvc.perform(post("/api/v1/notifications/filter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("notifications[0].priority"));
    }

    @Test
    void filter_badMetadataType_returns400() throws Exception {
        String body = """
                {"notifications":[{"id":"N-1","type":"error","category":"workflow","priority":"high",
                  "createdAt":0,"metadata":{"responseTimeMs":"fast"}}]}
                """;

        mockMvc.perform(post("/api/v1/notifications/filter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("metadata.responseTimeMs"));
    }

    @Test
    void filter_malformedQuietHours_returns400() throws Exception {
        String body = """
                {"notifications":[{"id":"N-1","type":"error","category":"workflow","priority":"high","createdAt":0}],
                 "context":{"userPreferences":{"quietHours":{"start":"25:99","end":"07:00"}}}}
                """;

        mockMvc.perform(post("/api/v1/notifications/filter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("quietHours.start"));

        verifyNoInteractions(filterPipeline);
    }

    @Test
    void filter_unknownQuietHoursZone_returns400() throws Exception {
        String body = """
                {"notifications":[{"id":"N-1","type":"error","category":"workflow","priority":"high","createdAt":0}],
                 "context":{"userPreferences":{"quietHours":{"start":"22:00","end":"07:00","zoneId":"Mars/Olympus"}}}}
                """;

        mockMvc.perform(post("/api/v1/notifications/filter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("quietHours.zoneId"));
    }

    @Test
    void filter_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/notifications/filter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notifications\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    // ── Rule filter ──

    @Test
    void ruleFilter_success() throws Exception {
        FilterResult result = FilterResult.builder()
                .excluded(List.of(notification))
                .statistics(FilterStatistics.of(0, 1))
                .exclusionReasons(Map.of("N-1", List.of("Priority critical is not in the allowed priorities")))
                .build();
        when(ruleFilter.filter(anyList(), any(), any())).thenReturn(result);

        RuleFilterRequest request = new RuleFilterRequest(List.of(notification), new FilterCriteria(), null);

        mockMvc.perform(post("/api/v1/notifications/rule-filter")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.statistics.excluded").value(1))
                .andExpect(jsonPath("$.exclusionReasons['N-1'][0]").value("Priority critical is not in the allowed priorities"));
    }

    // ── Score ──

    @Test
    void score_success() throws Exception {
        ContextScore score = ContextScore.builder()
                .notificationId("N-1")
                .relevance(0.39)
                .priorityAdjustment(0.1)
                .build();
        when(contextScorer.score(any(), any())).thenReturn(score);

        mockMvc.perform(post("/api/v1/notifications/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ScoreRequest(notification, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.relevance").value(0.39))
                .andExpect(jsonPath("$.notificationId").value("N-1"))
                .andExpect(jsonPath("$.priorityAdjustment").value(0.1));
    }

    @Test
    void score_missingNotification_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/notifications/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("notification"));
    }

    // ── Model updates ──

    @Test
    void updateModel_accepted() throws Exception {
        when(filterPipeline.updateModel(anyList(), any())).thenReturn(true);

        mockMvc.perform(post("/api/v1/notifications/model-updates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new FilterRequest(List.of(notification), null, null))))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.applied").value(true))
                .andExpect(jsonPath("$.notifications").value(1));
    }

    @Test
    void updateModel_predictorFails_returns502() throws Exception {
        when(filterPipeline.updateModel(anyList(), any())).thenThrow(new PredictionException("feedback endpoint down"));

        mockMvc.perform(post("/api/v1/notifications/model-updates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new FilterRequest(List.of(notification), null, null))))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("feedback endpoint down"));
    }
}
