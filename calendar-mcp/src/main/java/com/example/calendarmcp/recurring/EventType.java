package com.example.calendarmcp.recurring;

public enum EventType {
    SINGLE,
    RECURRING
}
