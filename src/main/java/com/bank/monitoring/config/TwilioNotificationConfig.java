package com.bank.monitoring.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.stream.Stream;

/**
 * SMS / WhatsApp channel for CRITICAL alerts. Disabled unless {@code twilio.enabled=true},
 * in which case credentials and both numbers must be set or the context fails to start.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private boolean enabled = false;

    private String accountSid;
    private String authToken;
    private String fromNumber;

    // On-call number receiving CRITICAL alerts
    private String toNumber;

    @Pattern(regexp = "sms|whatsapp", message = "channel must be 'sms' or 'whatsapp'")
    private String channel = "sms";

    @AssertTrue(message = "twilio.account-sid, auth-token, from-number and to-number are required when twilio.enabled=true")
    public boolean isComplete() {
        return !enabled || Stream.of(accountSid, authToken, fromNumber, toNumber)
                .allMatch(value -> value != null && !value.isBlank());
    }
}
