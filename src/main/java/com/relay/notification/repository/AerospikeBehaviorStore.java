package com.relay.notification.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.notification.config.AerospikeConfig;
import com.relay.notification.model.UserBehaviorPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Optional;

/**
 * Behavior patterns stored as one JSON document per user.
 * Read and write failures are logged and reported as a miss so the caller can re-analyze.
 */
@Repository
@ConditionalOnProperty(name = "notification.filter.behavior-store.type", havingValue = "aerospike")
public class AerospikeBehaviorStore implements BehaviorStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeBehaviorStore.class);

    static final String BIN_USER_ID = "userId";
    static final String BIN_PATTERN_JSON = "patternJson";
    static final String BIN_UPDATED_AT = "updatedAt";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AerospikeBehaviorStore(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("behaviorWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("behaviorReadPolicy") Policy readPolicy,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<UserBehaviorPattern> load(String userId) {
        Key key = new Key(namespace, AerospikeConfig.SET_BEHAVIOR_PATTERNS, userId);
        try {
            Record record = client.get(readPolicy, key);
            if (record == null) {
                return Optional.empty();
            }
            String json = record.getString(BIN_PATTERN_JSON);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, UserBehaviorPattern.class));
        } catch (AerospikeException e) {
            log.warn("Failed to read behavior pattern for {}: {}", userId, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable behavior pattern for {}: {}", userId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(String userId, UserBehaviorPattern pattern) {
        Key key = new Key(namespace, AerospikeConfig.SET_BEHAVIOR_PATTERNS, userId);
        try {
            String json = objectMapper.writeValueAsString(pattern);
            client.put(writePolicy, key,
                    new Bin(BIN_USER_ID, userId),
                    new Bin(BIN_PATTERN_JSON, json),
                    new Bin(BIN_UPDATED_AT, clock.millis()));
            log.debug("Saved behavior pattern for {}", userId);
        } catch (AerospikeException | JsonProcessingException e) {
            log.error("Failed to save behavior pattern for {}", userId, e);
        }
    }
}
