package com.relay.notification.engine.gate;

import com.relay.notification.model.Notification;
import org.springframework.stereotype.Component;

/**
 * Default duplicate detector. Nothing is a duplicate.
 */
@Component
public class NoOpDuplicateDetector implements DuplicateDetector {

    @Override
    public boolean isDuplicate(Notification notification) {
        return false;
    }
}
