package com.fintech.recurringcharges.dto;

import com.fintech.recurringcharges.entity.PatternStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body for activate, pause and resume calls.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusChangeRequest {

    @NotBlank
    private String reviewerId;

    @NotNull
    private PatternStatus expectedStatus;
}
