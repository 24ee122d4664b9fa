package com.flagship.gift_card_ledger.observability;

import com.flagship.gift_card_ledger.commission.CommissionRepository;
import com.flagship.gift_card_ledger.commission.CommissionStatus;
import com.flagship.gift_card_ledger.consumer.FailedJobRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Refreshes cached gauge values off the scrape path: the outbox backlog,
 * commissions per status and jobs that ended in {@code failed_jobs}.
 */
@Component
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final CommissionRepository commissionRepository;
    private final FailedJobRepository failedJobRepository;

    private final Map<CommissionStatus, AtomicLong> commissionsByStatus = new EnumMap<>(CommissionStatus.class);
    private final AtomicLong failedJobs = new AtomicLong(0);

    public MetricsScheduler(OutboxMetrics outboxMetrics,
                            CommissionRepository commissionRepository,
                            FailedJobRepository failedJobRepository,
                            MeterRegistry meterRegistry) {
        this.outboxMetrics = outboxMetrics;
        this.commissionRepository = commissionRepository;
        this.failedJobRepository = failedJobRepository;

        for (CommissionStatus status : CommissionStatus.values()) {
            AtomicLong count = new AtomicLong(0);
            commissionsByStatus.put(status, count);
            Gauge.builder("commission.count", count, AtomicLong::get)
                    .description("Commissions by status")
                    .tag("status", status.name())
                    .register(meterRegistry);
        }
        Gauge.builder("jobs.failed.count", failedJobs, AtomicLong::get)
                .description("Jobs that used up their attempts")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshMetrics() {
        outboxMetrics.refreshMetrics();
        try {
            commissionsByStatus.forEach((status, count) -> count.set(commissionRepository.countByStatus(status)));
            failedJobs.set(failedJobRepository.count());
        } catch (DataAccessException e) {
            log.warn("Failed to refresh settlement metrics: {}", e.getMessage());
        }
    }
}
