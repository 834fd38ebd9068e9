package com.fintech.recurringcharges.scheduler;

import com.fintech.recurringcharges.dto.DetectionResult;
import com.fintech.recurringcharges.exception.RecurringChargeException;
import com.fintech.recurringcharges.exception.TransactionSourceException;
import com.fintech.recurringcharges.service.RecurringChargePatternService;
import com.fintech.recurringcharges.service.TransactionHistoryClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically runs detection for every user the transaction source reports as active.
 * <p>
 * A failure for one user is logged and the run moves on to the next user.
 * Default: every 24 hours, disabled unless {@code recurring.scheduler.enabled} is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DetectionScheduler {

    private final RecurringChargePatternService patternService;
    private final TransactionHistoryClient transactionHistoryClient;

    @Value("${recurring.scheduler.enabled:false}")
    private boolean schedulerEnabled;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${recurring.scheduler.interval-ms:86400000}")
    public void runScheduledDetection() {
        if (!schedulerEnabled) {
            log.debug("Scheduler is disabled, skipping detection run");
            return;
        }
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Detection run already in progress, skipping this run");
            return;
        }

        log.info("Starting scheduled recurring charge detection at {}", LocalDateTime.now());
        try {
            List<String> users = transactionHistoryClient.findUsersWithActivity();
            int patterns = 0;
            int failures = 0;
            for (String userId : users) {
                try {
                    DetectionResult result = patternService.detectAndSave(userId);
                    patterns += result.getPatternCount();
                } catch (TransactionSourceException e) {
                    failures++;
                    log.warn("Skipping user {}: transaction history unavailable ({})", userId, e.getMessage());
                } catch (RecurringChargeException e) {
                    failures++;
                    log.warn("Detection failed for user {}: {}", userId, e.getMessage());
                }
            }
            log.info("Scheduled detection completed: {} users, {} new patterns, {} failures",
                    users.size(), patterns, failures);
        } catch (Exception e) {
            log.error("Scheduled detection failed with unexpected error", e);
        } finally {
            isRunning.set(false);
        }
    }

    public boolean isRunning() {
        return isRunning.get();
    }
}
