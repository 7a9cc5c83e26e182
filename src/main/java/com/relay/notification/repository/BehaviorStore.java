package com.relay.notification.repository;

import com.relay.notification.model.UserBehaviorPattern;

import java.util.Optional;

/**
 * Durable home for behavior patterns, consulted on a cache miss before the history is analyzed.
 */
public interface BehaviorStore {

    Optional<UserBehaviorPattern> load(String userId);

    void save(String userId, UserBehaviorPattern pattern);
}
