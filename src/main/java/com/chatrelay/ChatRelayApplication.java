package com.chatrelay;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the chat command relay.
 *
 * Consumes chat messages, routes prefixed commands to their handlers and keeps
 * process-wide command and outbound-call metrics, served at /metrics.
 */
@Slf4j
@SpringBootApplication
public class ChatRelayApplication {

    public static void main(String[] args) {
        log.info("Starting Chat Relay Application...");
        SpringApplication.run(ChatRelayApplication.class, args);
        log.info("Chat Relay Application started successfully");
    }
}
