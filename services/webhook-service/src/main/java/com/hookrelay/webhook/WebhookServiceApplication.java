package com.hookrelay.webhook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Receives third-party webhooks and relays notifications downstream.
 */
@SpringBootApplication(scanBasePackages = {"com.hookrelay.webhook", "com.hookrelay.common"})
public class WebhookServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebhookServiceApplication.class, args);
    }
}
