package com.relay.notification.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.notification.config.AerospikeConfig;
import com.relay.notification.model.EngagementPattern;
import com.relay.notification.model.FatigueIndicators;
import com.relay.notification.model.NotificationCategory;
import com.relay.notification.model.NotificationType;
import com.relay.notification.model.UserBehaviorPattern;
import com.relay.notification.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AerospikeBehaviorStoreTest {

    private static final String NAMESPACE = "notifications";

    @Mock
    private AerospikeClient client;

    private final WritePolicy writePolicy = new WritePolicy();
    private final Policy readPolicy = new Policy();
    private AerospikeBehaviorStore store;

    @BeforeEach
    void setUp() {
        store = new AerospikeBehaviorStore(client, NAMESPACE, writePolicy, readPolicy,
                new ObjectMapper(), TestDataFactory.fixedClock());
    }

    @Test
    void saveThenLoad_roundTripsPattern() {
        UserBehaviorPattern pattern = samplePattern();
        Map<String, Object> bins = new HashMap<>();
        doAnswer(invocation -> {
            Object[] args = invocation.getArguments();
            for (int i = 2; i < args.length; i++) {
                collect(bins, args[i]);
            }
            return null;
        }).when(client).put(eq(writePolicy), any(Key.class), any(Bin[].class));

        store.save("user-1", pattern);

        assertThat(bins).containsEntry(AerospikeBehaviorStore.BIN_USER_ID, "user-1")
                .containsEntry(AerospikeBehaviorStore.BIN_UPDATED_AT, TestDataFactory.NOW.toEpochMilli());

        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(new Record(bins, 1, 0));

        assertThat(store.load("user-1")).contains(pattern);
    }

    @Test
    void load_usesBehaviorSetAndUserKey() {
        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(null);

        store.load("user-7");

        verify(client).get(readPolicy, new Key(NAMESPACE, AerospikeConfig.SET_BEHAVIOR_PATTERNS, "user-7"));
    }

    @Test
    void load_missingRecord_empty() {
        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(null);

        assertThat(store.load("user-1")).isEmpty();
    }

    @Test
    void load_unreadableJson_empty() {
        Map<String, Object> bins = new HashMap<>();
        bins.put(AerospikeBehaviorStore.BIN_PATTERN_JSON, "{not json");
        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(new Record(bins, 1, 0));

        assertThat(store.load("user-1")).isEmpty();
    }

    @Test
    void load_clusterError_empty() {
        when(client.get(eq(readPolicy), any(Key.class)))
                .thenThrow(new AerospikeException(ResultCode.TIMEOUT, "read timed out"));

        assertThat(store.load("user-1")).isEmpty();
    }

    @Test
    void save_clusterError_logged() {
        doThrow(new AerospikeException(ResultCode.SERVER_NOT_AVAILABLE, "no nodes"))
                .when(client).put(eq(writePolicy), any(Key.class), any(Bin[].class));

        assertThatCode(() -> store.save("user-1", samplePattern())).doesNotThrowAnyException();
    }

    private static void collect(Map<String, Object> bins, Object arg) {
        if (arg instanceof Bin bin) {
            bins.put(bin.name, bin.value.getObject());
        } else if (arg instanceof Bin[] array) {
            for (Bin bin : array) {
                bins.put(bin.name, bin.value.getObject());
            }
        }
    }

    private static UserBehaviorPattern samplePattern() {
        Map<NotificationCategory, EngagementPattern> engagement = new EnumMap<>(NotificationCategory.class);
        engagement.put(NotificationCategory.WORKFLOW, new EngagementPattern(0.25, 2000.0));
        return UserBehaviorPattern.builder()
                .userId("user-1")
                .preferredHours(List.of(9, 14))
                .preferredCategories(List.of(NotificationCategory.WORKFLOW))
                .preferredTypes(List.of(NotificationType.ERROR))
                .engagementPatterns(engagement)
                .fatigueIndicators(new FatigueIndicators(4, 1800000.0, 0L))
                .build();
    }
}
