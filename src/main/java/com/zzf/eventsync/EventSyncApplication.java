package com.zzf.eventsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EventSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventSyncApplication.class, args);
    }
}
