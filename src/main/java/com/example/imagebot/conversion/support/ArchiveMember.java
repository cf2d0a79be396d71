package com.example.imagebot.conversion.support;

import java.nio.file.Path;

public record ArchiveMember(String name, Path file) {
}
