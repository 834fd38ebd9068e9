package com.fintech.recurringcharges.service.analyzers;

import com.fintech.recurringcharges.entity.RecurrenceFrequency;
import com.fintech.recurringcharges.model.AccountType;
import lombok.Value;

@Value(staticConstructor = "of")
public class AdjustmentKey {

    AccountType accountType;
    RecurrenceFrequency frequency;
    MerchantCategory category;
}
