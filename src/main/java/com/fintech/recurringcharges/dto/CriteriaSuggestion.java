package com.fintech.recurringcharges.dto;

import com.fintech.recurringcharges.service.criteria.AmountCoverage;
import com.fintech.recurringcharges.service.criteria.AmountCriteria;
import com.fintech.recurringcharges.service.criteria.MerchantCriteria;
import com.fintech.recurringcharges.service.criteria.TemporalCriteria;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Criteria suggestions for a pattern's original transactions, shown to reviewers before editing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CriteriaSuggestion {

    private String patternId;
    private MerchantCriteria merchant;
    private AmountCriteria amount;
    private AmountCoverage amountCoverage;
    private TemporalCriteria temporal;
    private String merchantRegex;
}
