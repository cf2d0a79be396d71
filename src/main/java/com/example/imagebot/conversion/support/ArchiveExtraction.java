package com.example.imagebot.conversion.support;

import java.util.List;

public record ArchiveExtraction(List<ArchiveMember> members, int overflow) {

    public ArchiveExtraction {
        members = List.copyOf(members);
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }
}
