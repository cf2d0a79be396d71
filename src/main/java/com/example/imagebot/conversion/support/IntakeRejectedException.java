package com.example.imagebot.conversion.support;

import lombok.Getter;

@Getter
public class IntakeRejectedException extends RuntimeException {

    public enum Reason {
        UNSUPPORTED_DOCUMENT,
        FILE_TOO_LARGE,
        BATCH_FULL,
        NO_SUPPORTED_IMAGES
    }

    private final Reason reason;

    public IntakeRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
