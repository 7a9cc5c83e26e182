package com.relay.notification.engine.gate;

import com.relay.notification.model.Notification;

public interface SpamDetector {

    boolean isSpam(Notification notification);
}
