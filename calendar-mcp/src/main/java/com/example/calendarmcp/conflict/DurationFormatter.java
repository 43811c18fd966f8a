package com.example.calendarmcp.conflict;

import java.time.Duration;

final class DurationFormatter {
    private DurationFormatter() {
    }

    static String format(Duration duration) {
        long minutes = Math.max(0, duration.toMinutes());
        long hours = minutes / 60;
        long days = hours / 24;

        if (days > 0) {
            long remainingHours = hours % 24;
            return remainingHours > 0
                    ? unit(days, "day") + " " + unit(remainingHours, "hour")
                    : unit(days, "day");
        }
        if (hours > 0) {
            long remainingMinutes = minutes % 60;
            return remainingMinutes > 0
                    ? unit(hours, "hour") + " " + unit(remainingMinutes, "minute")
                    : unit(hours, "hour");
        }
        return unit(minutes, "minute");
    }

    private static String unit(long amount, String name) {
        return amount + " " + (amount == 1 ? name : name + "s");
    }
}
