package com.example.imagebot.conversion.model;

public record IntakeResult(int added, int rejected, int pendingCount) {
}
