package com.fintech.recurringcharges.dto;

public enum ReviewActionType {
    CONFIRM,
    REJECT,
    EDIT
}
