package com.bank.monitoring.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertingConfigTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void defaults_areValid() {
        assertThat(validator.validate(new AlertingConfig())).isEmpty();
    }

    @Test
    void cooldownAboveOneWeek_isRejected() {
        AlertingConfig config = new AlertingConfig();
        config.setCooldownSeconds(AlertingConfig.MAX_COOLDOWN_SECONDS + 1);

        assertThat(validator.validate(config))
                .extracting(v -> v.getPropertyPath().toString())
                .containsExactly("cooldownSeconds");
    }

    @Test
    void zeroCooldown_isAllowed() {
        AlertingConfig config = new AlertingConfig();
        config.setCooldownSeconds(0);

        assertThat(validator.validate(config)).isEmpty();
    }
}
