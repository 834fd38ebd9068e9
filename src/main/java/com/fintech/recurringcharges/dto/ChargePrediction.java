package com.fintech.recurringcharges.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Expected next occurrence of a recurring charge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargePrediction {

    private String patternId;
    private LocalDate nextExpectedDate;
    private long daysUntilDue;

    private BigDecimal expectedAmount;
    private BigDecimal minAmount;
    private BigDecimal maxAmount;

    private double confidence;
}
