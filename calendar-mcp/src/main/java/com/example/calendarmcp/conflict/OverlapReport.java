package com.example.calendarmcp.conflict;

import com.example.calendarmcp.time.TimeWindow;

import java.time.Duration;

public record OverlapReport(Duration duration, String durationText, int percentage, TimeWindow window) {
}
