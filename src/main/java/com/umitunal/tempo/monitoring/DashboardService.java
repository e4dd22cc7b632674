package com.umitunal.tempo.monitoring;

import com.umitunal.tempo.core.StoreMetrics;
import com.umitunal.tempo.engine.JobScheduler;
import com.umitunal.tempo.storage.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only monitoring queries plus the few control actions a dashboard
 * offers. Control actions go through a {@link ControlAuthorizer}.
 */
public class DashboardService {
    private static final Logger log = LoggerFactory.getLogger(DashboardService.class);
    static final int DEFAULT_FAILURE_LIMIT = 20;

    private final JobScheduler scheduler;
    private final JobStore store;
    private final ControlAuthorizer authorizer;
    private final Clock clock;

    public DashboardService(JobScheduler scheduler, JobStore store, ControlAuthorizer authorizer, Clock clock) {
        this.scheduler = scheduler;
        this.store = store;
        this.authorizer = authorizer;
        this.clock = clock;
    }

    public DashboardSnapshot snapshot() {
        StoreMetrics metrics = store.getMetrics();
        return new DashboardSnapshot(clock.instant(), metrics.getCountsByState(), metrics.getPendingContinuations(),
                recurringJobs(), recentFailures(DEFAULT_FAILURE_LIMIT));
    }

    public List<DashboardSnapshot.FailedJobView> recentFailures(int limit) {
        return store.recentFailures(limit).stream()
                .map(DashboardSnapshot.FailedJobView::new)
                .collect(Collectors.toList());
    }

    public List<DashboardSnapshot.RecurringJobView> recurringJobs() {
        return store.listRecurring().stream()
                .map(DashboardSnapshot.RecurringJobView::new)
                .collect(Collectors.toList());
    }

    /**
     * @return the spawned job id, or empty if no such recurring job exists
     * @throws UnauthorizedControlException if the caller may not trigger jobs
     */
    public Optional<String> triggerRecurring(String caller, String recurringId) {
        authorize(caller, ControlAuthorizer.Action.TRIGGER_RECURRING, recurringId);
        return scheduler.triggerRecurring(recurringId);
    }

    /**
     * @return true if the job moved to DELETED
     * @throws UnauthorizedControlException if the caller may not delete jobs
     */
    public boolean deleteJob(String caller, String jobId) {
        authorize(caller, ControlAuthorizer.Action.DELETE_JOB, jobId);
        return scheduler.delete(jobId);
    }

    private void authorize(String caller, ControlAuthorizer.Action action, String target) {
        if (!authorizer.isAllowed(caller, action, target)) {
            log.warn("Denied {} on {} for caller '{}'", action, target, caller);
            throw new UnauthorizedControlException(caller, action, target);
        }
        log.info("Caller '{}' requested {} on {}", caller, action, target);
    }
}
