package com.example.imagebot.conversion.support;

public class ImageEncodeException extends RuntimeException {

    public ImageEncodeException(String message) {
        super(message);
    }

    public ImageEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
