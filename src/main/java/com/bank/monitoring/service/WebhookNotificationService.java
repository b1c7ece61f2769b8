package com.bank.monitoring.service;

import com.bank.monitoring.config.ExecutorConfig;
import com.bank.monitoring.config.MetricsConfig;
import com.bank.monitoring.config.WebhookNotificationConfig;
import com.bank.monitoring.model.AlertRecord;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Posts CRITICAL alerts to an HTTP webhook (e.g. a paging integration).
 *
 * Delivery runs on the notification executor with the connect/read timeouts of
 * {@code webhookRestTemplate}, so a slow endpoint never holds up the dispatcher.
 */
@Service
public class WebhookNotificationService {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationService.class);
    private static final String CHANNEL = "webhook";

    private final WebhookNotificationConfig config;
    private final RestTemplate restTemplate;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public WebhookNotificationService(WebhookNotificationConfig config,
                                      @Qualifier("webhookRestTemplate") RestTemplate restTemplate,
                                      MetricsConfig metricsConfig,
                                      Clock clock) {
        this.config = config;
        this.restTemplate = restTemplate;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            log.info("Webhook notification service initialized. Timeout: {}s", config.getTimeoutSeconds());
        } else {
            log.info("Webhook notification service is DISABLED (monitoring.webhook.url not set).");
        }
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Async(ExecutorConfig.NOTIFICATION_EXECUTOR)
    @Observed(name = "notification.webhook", contextualName = "send-webhook-alert")
    public void notifyCritical(AlertRecord alert) {
        if (!config.isEnabled()) {
            return;
        }

        try {
            ResponseEntity<Void> response = restTemplate.postForEntity(config.getUrl(), buildPayload(alert), Void.class);
            metricsConfig.recordNotification(CHANNEL, "success");
            log.info("Webhook alert sent for status={}, severity={}, httpStatus={}",
                    alert.getStatus(), alert.getSeverity(), response.getStatusCode().value());
        } catch (Exception e) {
            metricsConfig.recordNotification(CHANNEL, "error");
            log.error("Failed to send webhook alert for status={}: {}", alert.getStatus(), e.getMessage(), e);
        }
    }

    Map<String, Object> buildPayload(AlertRecord alert) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", alert.getStatus());
        details.put("severity", alert.getSeverity().name());
        details.put("current_value", alert.getCurrentValue());
        details.put("baseline_mean", alert.getBaselineMean());
        details.put("baseline_std", alert.getBaselineStd());
        details.put("z_score", alert.getZScore());
        details.put("score", alert.getScore());
        details.put("timestamp", alert.getTimestamp().toString());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("severity", alert.getSeverity().name());
        payload.put("message", String.format(Locale.ROOT,
                "ALERT: %s transactions anomaly, count=%d, z_score=%.2f (baseline mean=%.2f, std=%.2f)",
                alert.getStatus(), alert.getCurrentValue(), alert.getZScore(),
                alert.getBaselineMean(), alert.getBaselineStd()));
        payload.put("timestamp", clock.instant().toString());
        payload.put("service", config.getServiceName());
        payload.put("anomaly_details", details);
        payload.put("alert_statuses", List.of(alert.getStatus()));
        payload.put("score", alert.getScore());
        return payload;
    }
}
