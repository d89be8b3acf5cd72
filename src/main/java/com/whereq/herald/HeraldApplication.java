package com.whereq.herald;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Herald.
 * This service schedules one-shot and recurring notifications, delivers them
 * through webhooks and recovers its schedule from Redis after a restart.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class HeraldApplication {

    public static void main(String[] args) {
        SpringApplication.run(HeraldApplication.class, args);
    }
}
