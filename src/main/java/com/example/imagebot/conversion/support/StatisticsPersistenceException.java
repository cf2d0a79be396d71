package com.example.imagebot.conversion.support;

public class StatisticsPersistenceException extends RuntimeException {

    public StatisticsPersistenceException(String message) {
        super(message);
    }

    public StatisticsPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
