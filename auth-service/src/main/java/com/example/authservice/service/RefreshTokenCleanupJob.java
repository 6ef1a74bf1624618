package com.example.authservice.service;

import com.example.authservice.store.RefreshTokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Purges refresh records that expired more than a day ago.
 * Expired records can no longer rotate, so only the reuse-detection window is lost.
 */
@Component
public class RefreshTokenCleanupJob {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenCleanupJob.class);

    static final Duration RETENTION = Duration.ofDays(1);

    private final RefreshTokenStore refreshTokenStore;
    private final Clock clock;

    public RefreshTokenCleanupJob(RefreshTokenStore refreshTokenStore, Clock clock) {
        this.refreshTokenStore = refreshTokenStore;
        this.clock = clock;
    }

    @Scheduled(cron = "${auth.refresh-cleanup-cron:0 0 3 * * *}")
    public void purgeExpired() {
        Instant cutoff = clock.instant().minus(RETENTION);
        int deleted = refreshTokenStore.deleteExpiredBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} expired refresh token record(s)", deleted);
        }
    }
}
