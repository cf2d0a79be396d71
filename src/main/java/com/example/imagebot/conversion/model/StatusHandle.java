package com.example.imagebot.conversion.model;

public record StatusHandle(long chatId, int messageId) {
}
