package com.example.imagebot.conversion.model;

import java.util.Locale;

public enum StatisticsScope {
    TODAY,
    MONTH,
    ALL;

    public static StatisticsScope fromArgument(String argument) {
        if (argument == null) {
            return ALL;
        }
        return switch (argument.trim().toLowerCase(Locale.ROOT)) {
            case "today" -> TODAY;
            case "month" -> MONTH;
            default -> ALL;
        };
    }
}
