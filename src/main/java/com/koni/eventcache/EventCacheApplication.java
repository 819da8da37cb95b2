package com.koni.eventcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventCacheApplication.class, args);
    }
}
