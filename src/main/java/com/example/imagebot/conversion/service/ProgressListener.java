package com.example.imagebot.conversion.service;

interface ProgressListener {

    void onProgress(int converted, int total, long originalBytes, long convertedBytes);

    default void onItemFailed(String originalName) {
    }
}
