package com.bank.monitoring.service;

import com.bank.monitoring.config.ExecutorConfig;
import com.bank.monitoring.config.MetricsConfig;
import com.bank.monitoring.config.TwilioNotificationConfig;
import com.bank.monitoring.model.AlertRecord;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Async(ExecutorConfig.NOTIFICATION_EXECUTOR)
    @Observed(name = "notification.send", contextualName = "send-sms-alert")
    public void notifyCritical(AlertRecord alert) {
        if (!config.isEnabled()) {
            return;
        }

        try {
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    buildMessageBody(alert)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio alert sent for status={}, sid={}", alert.getStatus(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio alert for status={}: {}", alert.getStatus(), e.getMessage(), e);
        }
    }

    String buildMessageBody(AlertRecord alert) {
        return String.format(Locale.ROOT,
                "[TRANSACTION ALERT] %s\n" +
                "Status: %s\n" +
                "Count: %d (baseline %.1f ± %.1f)\n" +
                "Z-score: %.2f\n" +
                "Action: Check payment gateway status and system health",
                alert.getSeverity(),
                alert.getStatus(),
                alert.getCurrentValue(),
                alert.getBaselineMean(),
                alert.getBaselineStd(),
                alert.getZScore());
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
