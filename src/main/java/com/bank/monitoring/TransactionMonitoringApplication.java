package com.bank.monitoring;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class TransactionMonitoringApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransactionMonitoringApplication.class, args);
    }
}
