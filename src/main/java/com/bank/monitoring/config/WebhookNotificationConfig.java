package com.bank.monitoring.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "monitoring.webhook")
public class WebhookNotificationConfig {

    // Blank disables out-of-band webhook alerts; logging is unaffected.
    private String url;

    @Positive
    private int timeoutSeconds = 5;

    private String serviceName = "transaction-monitoring";

    public boolean isEnabled() {
        return url != null && !url.isBlank();
    }
}
