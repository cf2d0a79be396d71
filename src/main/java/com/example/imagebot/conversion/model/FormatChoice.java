package com.example.imagebot.conversion.model;

public record FormatChoice(String label, String callbackData) {

    public static final String CALLBACK_PREFIX = "convert_";

    public static FormatChoice of(TargetFormat format) {
        return new FormatChoice(format.name(), CALLBACK_PREFIX + format.token());
    }
}
