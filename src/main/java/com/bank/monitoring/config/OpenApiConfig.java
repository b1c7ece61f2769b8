package com.bank.monitoring.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI transactionMonitoringOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Transaction Monitoring API")
                        .version("1.0.0")
                        .description(
                                "Rolling z-score anomaly detection over per-minute transaction status counts.\n\n" +
                                "**Detection:**\n" +
                                "1. Per-minute counts are ingested via `POST /transactions` or `POST /transactions/batch`\n" +
                                "2. Each monitored status is compared with its trailing 60-minute baseline\n" +
                                "3. `z = (current - mean) / max(std, 1.0)`; **WARNING** above 2.5, **CRITICAL** above 4.0\n" +
                                "4. Fewer than 30 minutes of history: NORMAL (warm-up)\n\n" +
                                "**Alerting:**\n" +
                                "- A background check runs every 30 seconds and dispatches alerts for anomalous statuses\n" +
                                "- Alerts for the same status + severity are suppressed for a 5-minute cooldown\n" +
                                "- WARNING alerts are logged; CRITICAL alerts are also sent to the webhook / SMS channel\n\n" +
                                "**Monitored statuses:** denied, failed, reversed, backend_reversed (problem statuses), approved")
                        .contact(new Contact().name("Transaction Monitoring Team")));
    }
}
