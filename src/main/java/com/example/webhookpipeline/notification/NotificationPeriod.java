package com.example.webhookpipeline.notification;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum NotificationPeriod {
    HOURLY,
    DAILY,
    WEEKLY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<NotificationPeriod> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(p -> p.wireName().equalsIgnoreCase(value)).findFirst();
    }
}
