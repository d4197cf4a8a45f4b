package com.hookrelay.webhook.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookrelay.common.signature.WebhookSignatureVerifier;
import com.hookrelay.webhook.filter.WebhookSignatureFilter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(WebhookProperties.class)
public class WebhookWebConfiguration {

    public static final String WEBHOOK_PATH_PATTERN = "/webhooks/*";

    @Bean
    public FilterRegistrationBean<WebhookSignatureFilter> webhookSignatureFilter(
            WebhookSignatureVerifier signatureVerifier, ObjectMapper objectMapper) {
        FilterRegistrationBean<WebhookSignatureFilter> registration =
                new FilterRegistrationBean<>(new WebhookSignatureFilter(signatureVerifier, objectMapper));
        registration.addUrlPatterns(WEBHOOK_PATH_PATTERN);
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        registration.setName("webhookSignatureFilter");
        return registration;
    }

    @Bean
    public RestTemplate notificationRestTemplate(RestTemplateBuilder builder, WebhookProperties properties) {
        WebhookProperties.Notification config = properties.getNotification();
        return builder
                .setConnectTimeout(config.getConnectTimeout())
                .setReadTimeout(config.getReadTimeout())
                .build();
    }
}
