package com.relay.notification;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NotificationFilterApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotificationFilterApplication.class, args);
    }
}
