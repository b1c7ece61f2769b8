package com.bank.monitoring.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MonitoredStatus {

    @NotBlank
    private String name;

    @NotNull
    private StatusCategory category = StatusCategory.VOLUME;
}
