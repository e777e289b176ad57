package com.podcast.bus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventBusApplication {
    public static void main(String[] args) {
        SpringApplication.run(EventBusApplication.class, args);
    }
}
