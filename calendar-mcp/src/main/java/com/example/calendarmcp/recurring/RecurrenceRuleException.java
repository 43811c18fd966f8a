package com.example.calendarmcp.recurring;

public class RecurrenceRuleException extends IllegalArgumentException {
    public RecurrenceRuleException(String message) {
        super(message);
    }
}
