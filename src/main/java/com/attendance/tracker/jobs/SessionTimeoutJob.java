package com.attendance.tracker.jobs;

import com.attendance.tracker.service.collection.AttendanceCollectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cancels collection sessions nobody has touched for the inactivity timeout and
 * announces them on "attendance.session.cancelled".
 * <p>
 * Configure (optional):
 * attendance.collection.sweep-interval-ms=30000
 * attendance.collection.inactivity-timeout=10m
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionTimeoutJob {

    private final AttendanceCollectionService collectionService;

    @Scheduled(fixedDelayString = "${attendance.collection.sweep-interval-ms:30000}",
            initialDelayString = "${attendance.collection.sweep-interval-ms:30000}")
    public void sweep() {
        try {
            int cancelled = collectionService.sweepStalled();
            if (cancelled > 0) {
                log.info("Session sweep cancelled {} stalled collection(s)", cancelled);
            }
        } catch (Exception e) {
            log.warn("Session sweep error: {}", e.getMessage(), e);
        }
    }
}
