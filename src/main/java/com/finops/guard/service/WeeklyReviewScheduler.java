package com.finops.guard.service;

import com.finops.guard.config.FinOpsGuardConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers the weekly review on the configured cron.
 * A failed run is logged; the next scheduled run still happens.
 */
@Component
public class WeeklyReviewScheduler {

    private static final Logger log = LoggerFactory.getLogger(WeeklyReviewScheduler.class);

    private final WeeklyReviewService reviewService;
    private final FinOpsGuardConfig config;

    public WeeklyReviewScheduler(WeeklyReviewService reviewService, FinOpsGuardConfig config) {
        this.reviewService = reviewService;
        this.config = config;
    }

    @Scheduled(cron = "${finops.schedule.cron:0 0 8 * * MON}")
    public void runScheduled() {
        if (!config.getSchedule().isEnabled()) {
            log.debug("Scheduled weekly review is disabled");
            return;
        }

        try {
            reviewService.runWeekly();
        } catch (Exception e) {
            log.error("Scheduled weekly review failed: {}", e.getMessage(), e);
        }
    }
}
