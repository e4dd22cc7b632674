package com.umitunal.tempo.engine;

/**
 * What one scheduler poller tick changed.
 */
public class TickReport {
    private final int promoted;
    private final int recurringFired;
    private final int leasesReclaimed;
    private final int leasesFailed;
    private final int continuationsResolved;
    private final int failuresRescheduled;
    private final long purged;

    TickReport(int promoted, int recurringFired, int leasesReclaimed, int leasesFailed,
               int continuationsResolved, int failuresRescheduled, long purged) {
        this.promoted = promoted;
        this.recurringFired = recurringFired;
        this.leasesReclaimed = leasesReclaimed;
        this.leasesFailed = leasesFailed;
        this.continuationsResolved = continuationsResolved;
        this.failuresRescheduled = failuresRescheduled;
        this.purged = purged;
    }

    /** Scheduled jobs moved to ENQUEUED. */
    public int getPromoted() { return promoted; }
    /** Jobs spawned from recurring definitions. */
    public int getRecurringFired() { return recurringFired; }
    /** Expired leases returned to SCHEDULED for another attempt. */
    public int getLeasesReclaimed() { return leasesReclaimed; }
    /** Expired leases with no attempts left, now FAILED. */
    public int getLeasesFailed() { return leasesFailed; }
    /** Continuations left behind by an interrupted completion and resolved now. */
    public int getContinuationsResolved() { return continuationsResolved; }
    /** FAILED jobs with attempts left that had no retry scheduled. */
    public int getFailuresRescheduled() { return failuresRescheduled; }
    public long getPurged() { return purged; }

    public boolean isIdle() {
        return promoted == 0 && recurringFired == 0 && leasesReclaimed == 0 && leasesFailed == 0
                && continuationsResolved == 0 && failuresRescheduled == 0 && purged == 0;
    }

    @Override
    public String toString() {
        return String.format("TickReport{promoted=%d, recurringFired=%d, reclaimed=%d, leaseFailed=%d, continuations=%d, rescheduled=%d, purged=%d}",
                promoted, recurringFired, leasesReclaimed, leasesFailed, continuationsResolved, failuresRescheduled, purged);
    }
}
