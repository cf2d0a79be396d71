package com.example.imagebot.conversion.service;

import com.example.imagebot.conversion.model.StagedImage;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
class StagedSessionSweeper {

    private final SessionStore sessionStore;
    private final Clock clock;
    private final Duration sessionTtl;

    StagedSessionSweeper(SessionStore sessionStore, Clock clock,
            @Value("${app.conversion.session-ttl:1h}") Duration sessionTtl) {
        this.sessionStore = sessionStore;
        this.clock = clock;
        this.sessionTtl = sessionTtl;
    }

    @Scheduled(fixedDelayString = "${app.conversion.session-sweep-interval:PT10M}",
            initialDelayString = "${app.conversion.session-sweep-interval:PT10M}")
    void sweep() {
        List<StagedImage> expired = sessionStore.expireIdleSessions(clock.instant().minus(sessionTtl));
        if (expired.isEmpty()) {
            return;
        }
        expired.forEach(StagedImage::deleteSilently);
        log.info("Deleted {} staged files from abandoned sessions", expired.size());
    }
}
