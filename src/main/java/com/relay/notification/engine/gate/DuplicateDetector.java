package com.relay.notification.engine.gate;

import com.relay.notification.model.Notification;

public interface DuplicateDetector {

    boolean isDuplicate(Notification notification);
}
