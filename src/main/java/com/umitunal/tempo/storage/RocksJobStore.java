package com.umitunal.tempo.storage;

import com.umitunal.tempo.config.StorageConfig;
import com.umitunal.tempo.core.ContinuationTrigger;
import com.umitunal.tempo.core.JobNotFoundException;
import com.umitunal.tempo.core.JobState;
import com.umitunal.tempo.core.JobStateMachine;
import com.umitunal.tempo.core.LeaseConflictException;
import com.umitunal.tempo.core.StoreMetrics;
import com.umitunal.tempo.core.StoreUnavailableException;
import com.umitunal.tempo.model.ContinuationLink;
import com.umitunal.tempo.model.JobRecord;
import com.umitunal.tempo.model.JobRecordSerializer;
import com.umitunal.tempo.model.RecurringJobDefinition;
import com.umitunal.tempo.model.RecurringJobSerializer;
import com.umitunal.tempo.model.StorageKeys;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed implementation of JobStore.
 *
 * Column families:
 * - {@code jobs}: jobId -> {@link JobRecord}
 * - {@code job_index}: [state][time][jobId] -> empty, where time is the lease
 *   expiry for PROCESSING jobs, the last modification for finished jobs, and
 *   the due time otherwise
 * - {@code recurring}: id -> {@link RecurringJobDefinition}
 * - {@code continuations}: [antecedentId][0x00][dependentId] -> {@link ContinuationLink}
 *
 * Every mutation is an optimistic transaction that reads the keys it changes
 * with {@code getForUpdate}. A commit conflict re-runs the work, which
 * re-checks its precondition against the fresh value, so a lost race turns
 * into a clean "no" instead of a double write.
 */
public class RocksJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(RocksJobStore.class);

    private static final byte[] JOBS_CF = "jobs".getBytes(UTF_8);
    private static final byte[] INDEX_CF = "job_index".getBytes(UTF_8);
    private static final byte[] RECURRING_CF = "recurring".getBytes(UTF_8);
    private static final byte[] CONTINUATIONS_CF = "continuations".getBytes(UTF_8);
    private static final byte[] EMPTY = new byte[0];
    private static final int MAX_CONFLICT_RETRIES = 8;

    private final Clock clock;
    private final OptimisticTransactionDB transactionDB;
    private final List<ColumnFamilyHandle> handles = new ArrayList<>();
    private final ColumnFamilyHandle jobs;
    private final ColumnFamilyHandle index;
    private final ColumnFamilyHandle recurring;
    private final ColumnFamilyHandle continuations;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions readOpts;
    private final ReadOptions scanReadOpts;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final AtomicLong txnConflictCount = new AtomicLong(0);

    public RocksJobStore(StorageConfig config) {
        this(config, Clock.systemUTC());
    }

    public RocksJobStore(StorageConfig config, Clock clock) {
        this.clock = clock;

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024L * 1024L);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.cfOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize(config.getMemoryBufferSizeMB() * 1024L * 1024L)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setTargetFileSizeBase(64L * 1024 * 1024)
                .setTableFormatConfig(tableConfig);

        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setAllowConcurrentMemtableWrite(true)
                .setEnableWriteThreadAdaptiveYield(true)
                .setMaxOpenFiles(-1);

        List<ColumnFamilyDescriptor> descriptors = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions),
                new ColumnFamilyDescriptor(JOBS_CF, cfOptions),
                new ColumnFamilyDescriptor(INDEX_CF, cfOptions),
                new ColumnFamilyDescriptor(RECURRING_CF, cfOptions),
                new ColumnFamilyDescriptor(CONTINUATIONS_CF, cfOptions));

        try {
            Files.createDirectories(Paths.get(config.getDataDirectory()));
            this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory(), descriptors, handles);
        } catch (IOException | RocksDBException e) {
            closeOptions();
            throw new StoreUnavailableException("Cannot open job store at " + config.getDataDirectory(), e);
        }
        this.jobs = handles.get(1);
        this.index = handles.get(2);
        this.recurring = handles.get(3);
        this.continuations = handles.get(4);

        // The WAL stays on; durable writes add an fsync per commit
        this.writeOpts = new WriteOptions().setSync(config.isDurableWrites());
        this.txnOpts = new OptimisticTransactionOptions().setSetSnapshot(true);
        this.readOpts = new ReadOptions();
        this.scanReadOpts = new ReadOptions().setFillCache(false);

        log.info("Opened job store at {} (durableWrites={})", config.getDataDirectory(), config.isDurableWrites());
    }

    // ========== Jobs ==========

    @Override
    public String create(NewJob request) {
        String jobId = UUID.randomUUID().toString();
        return execute("create", txn -> {
            long now = clock.millis();
            long scheduledFor = request.getScheduledFor() == null
                    ? now
                    : Math.max(request.getScheduledFor().toEpochMilli(), 0L);
            JobRecord job = new JobRecord(jobId, request.getPayload(), now, scheduledFor,
                    request.getMaxAttempts(), request.getTimeout().toMillis());
            if (request.getParentId() != null) {
                attachToParent(txn, job, request.getParentId(), request.getTrigger(), now);
            } else if (scheduledFor > now) {
                job.moveTo(JobState.SCHEDULED, now);
            } else {
                job.moveTo(JobState.ENQUEUED, now);
            }

            writeJob(txn, null, job);
            log.debug("Created job {} ({}) in {}", jobId, request.getPayload().getHandler(), job.getState());
            return jobId;
        }, () -> {
            throw new StoreUnavailableException("Create of job " + jobId + " kept conflicting", null);
        });
    }

    /**
     * Links a new continuation to its parent. A parent that already finished
     * resolves the dependent immediately, so no link is left behind for an
     * antecedent that will never fire it.
     */
    private void attachToParent(Transaction txn, JobRecord job, String parentId,
                                ContinuationTrigger trigger, long now) throws RocksDBException {
        JobRecord parent = readJobForUpdate(txn, parentId);
        if (parent == null) {
            throw new JobNotFoundException(parentId);
        }
        job.linkParent(parentId);
        job.moveTo(JobState.AWAITING_CONTINUATION, now);

        if (!parent.isTerminal()) {
            ContinuationLink link = new ContinuationLink(parentId, job.getId(), trigger, now);
            txn.put(continuations, StorageKeys.continuationKey(parentId, job.getId()), link.serialize());
            return;
        }
        if (trigger.matches(parent.getState())) {
            job.reschedule(now, now);
            job.moveTo(JobState.SCHEDULED, now);
        } else {
            job.recordError("Antecedent " + parentId + " finished as " + parent.getState()
                    + ", continuation requires " + trigger, now);
            job.moveTo(JobState.DELETED, now);
        }
    }

    @Override
    public Optional<JobRecord> find(String jobId) {
        try {
            byte[] value = transactionDB.get(jobs, readOpts, StorageKeys.jobKey(jobId));
            return value == null ? Optional.empty() : Optional.of(JobRecordSerializer.deserialize(value));
        } catch (RocksDBException e) {
            throw unavailable("find", e);
        }
    }

    @Override
    public boolean tryAcquireLease(String jobId, String workerId, Duration duration) {
        return execute("tryAcquireLease", txn -> {
            JobRecord job = readJobForUpdate(txn, jobId);
            long now = clock.millis();
            if (job == null || job.getState() != JobState.ENQUEUED || job.hasLiveLease(now)) {
                return false;
            }
            byte[] oldIndexKey = indexKeyOf(job);
            job.lease(workerId, now + duration.toMillis(), now);
            writeJob(txn, oldIndexKey, job);
            return true;
        }, () -> false);
    }

    @Override
    public boolean renewLease(String jobId, String workerId, Duration duration) {
        return execute("renewLease", txn -> {
            JobRecord job = readJobForUpdate(txn, jobId);
            long now = clock.millis();
            if (job == null || job.getLeaseOwner() == null) {
                return false;
            }
            if (job.getState() != JobState.PROCESSING && job.getState() != JobState.ENQUEUED) {
                return false;
            }
            if (!job.isLeasedBy(workerId)) {
                if (job.hasLiveLease(now)) {
                    throw new LeaseConflictException(jobId, job.getLeaseOwner());
                }
                return false;
            }
            byte[] oldIndexKey = indexKeyOf(job);
            job.extendLease(now + duration.toMillis(), now);
            writeJob(txn, oldIndexKey, job);
            return true;
        }, () -> false);
    }

    @Override
    public void releaseLease(String jobId, String workerId) {
        execute("releaseLease", txn -> {
            JobRecord job = readJobForUpdate(txn, jobId);
            if (job == null || !job.isLeasedBy(workerId)) {
                return false;
            }
            byte[] oldIndexKey = indexKeyOf(job);
            job.releaseLease(clock.millis());
            writeJob(txn, oldIndexKey, job);
            return true;
        }, () -> false);
    }

    @Override
    public boolean transition(String jobId, JobState from, JobState to, StateChange change) {
        JobStateMachine.requireLegal(jobId, from, to);
        return execute("transition", txn -> {
            JobRecord job = readJobForUpdate(txn, jobId);
            if (job == null || job.getState() != from) {
                return false;
            }
            long now = clock.millis();
            byte[] oldIndexKey = indexKeyOf(job);
            job.moveTo(to, now);
            if (to != JobState.PROCESSING && job.getLeaseOwner() != null) {
                job.releaseLease(now);
            }
            if (change.getError() != null) {
                job.recordError(change.getError(), now);
            }
            if (change.getScheduledFor() != null) {
                job.reschedule(change.getScheduledFor().toEpochMilli(), now);
            }
            writeJob(txn, oldIndexKey, job);
            log.debug("Job {} {} -> {}", jobId, from, to);
            return true;
        }, () -> false);
    }

    @Override
    public boolean failAndReschedule(String jobId, String error, Instant retryAt) {
        JobStateMachine.requireLegal(jobId, JobState.PROCESSING, JobState.FAILED);
        return execute("failAndReschedule", txn -> {
            JobRecord job = readJobForUpdate(txn, jobId);
            if (job == null || job.getState() != JobState.PROCESSING) {
                return false;
            }
            JobStateMachine.requireLegal(jobId, JobState.FAILED, JobState.SCHEDULED,
                    job.getAttempts(), job.getMaxAttempts());
            long now = clock.millis();
            byte[] oldIndexKey = indexKeyOf(job);
            job.moveTo(JobState.FAILED, now);
            job.releaseLease(now);
            job.recordError(error, now);
            job.moveTo(JobState.SCHEDULED, now);
            job.reschedule(retryAt.toEpochMilli(), now);
            writeJob(txn, oldIndexKey, job);
            log.debug("Job {} PROCESSING -> FAILED -> SCHEDULED at {}", jobId, retryAt);
            return true;
        }, () -> false);
    }

    @Override
    public List<String> queryDue(Instant before, int limit) {
        return scanIndex(JobState.SCHEDULED, before.toEpochMilli(), limit);
    }

    @Override
    public List<String> queryEnqueued(int limit) {
        return scanIndex(JobState.ENQUEUED, Long.MAX_VALUE, limit);
    }

    @Override
    public List<String> queryExpiredLeases(int limit) {
        return scanIndex(JobState.PROCESSING, clock.millis(), limit);
    }

    // ========== Continuations ==========

    @Override
    public List<ContinuationLink> continuationsOf(String antecedentId) {
        byte[] prefix = StorageKeys.continuationPrefix(antecedentId);
        List<ContinuationLink> links = new ArrayList<>();
        try (RocksIterator iter = transactionDB.newIterator(continuations, scanReadOpts)) {
            for (iter.seek(prefix); iter.isValid() && StorageKeys.hasPrefix(iter.key(), prefix); iter.next()) {
                links.add(ContinuationLink.deserialize(iter.value()));
            }
        }
        return links;
    }

    private boolean hasContinuations(String antecedentId) {
        byte[] prefix = StorageKeys.continuationPrefix(antecedentId);
        try (RocksIterator iter = transactionDB.newIterator(continuations, scanReadOpts)) {
            iter.seek(prefix);
            return iter.isValid() && StorageKeys.hasPrefix(iter.key(), prefix);
        }
    }

    @Override
    public List<String> continuationAntecedents(int limit) {
        Set<String> antecedents = new LinkedHashSet<>();
        try (RocksIterator iter = transactionDB.newIterator(continuations, scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid() && antecedents.size() < limit; iter.next()) {
                antecedents.add(ContinuationLink.deserialize(iter.value()).getAntecedentId());
            }
        }
        return new ArrayList<>(antecedents);
    }

    @Override
    public boolean resolveContinuation(ContinuationLink link, JobState target, String note) {
        JobStateMachine.requireLegal(link.getDependentId(), JobState.AWAITING_CONTINUATION, target);
        byte[] linkKey = StorageKeys.continuationKey(link.getAntecedentId(), link.getDependentId());
        return execute("resolveContinuation", txn -> {
            if (txn.getForUpdate(readOpts, continuations, linkKey, true) == null) {
                return false;
            }
            txn.delete(continuations, linkKey);

            JobRecord dependent = readJobForUpdate(txn, link.getDependentId());
            if (dependent == null || dependent.getState() != JobState.AWAITING_CONTINUATION) {
                return false;
            }
            long now = clock.millis();
            byte[] oldIndexKey = indexKeyOf(dependent);
            if (target == JobState.SCHEDULED) {
                dependent.reschedule(now, now);
            }
            if (note != null) {
                dependent.recordError(note, now);
            }
            dependent.moveTo(target, now);
            writeJob(txn, oldIndexKey, dependent);
            return true;
        }, () -> false);
    }

    // ========== Recurring definitions ==========

    @Override
    public RecurringJobDefinition upsertRecurring(RecurringJobDefinition definition) {
        byte[] key = StorageKeys.recurringKey(definition.getId());
        return execute("upsertRecurring", txn -> {
            byte[] existingValue = txn.getForUpdate(readOpts, recurring, key, true);
            RecurringJobDefinition stored = definition;
            if (existingValue != null) {
                stored = RecurringJobSerializer.deserialize(existingValue);
                stored.redefine(definition, clock.millis());
            }
            txn.put(recurring, key, RecurringJobSerializer.serialize(stored));
            return stored;
        }, () -> {
            throw new StoreUnavailableException("Upsert of recurring job " + definition.getId() + " kept conflicting", null);
        });
    }

    @Override
    public Optional<RecurringJobDefinition> findRecurring(String recurringId) {
        try {
            byte[] value = transactionDB.get(recurring, readOpts, StorageKeys.recurringKey(recurringId));
            return value == null ? Optional.empty() : Optional.of(RecurringJobSerializer.deserialize(value));
        } catch (RocksDBException e) {
            throw unavailable("findRecurring", e);
        }
    }

    @Override
    public boolean removeRecurring(String recurringId) {
        byte[] key = StorageKeys.recurringKey(recurringId);
        return execute("removeRecurring", txn -> {
            if (txn.getForUpdate(readOpts, recurring, key, true) == null) {
                return false;
            }
            txn.delete(recurring, key);
            return true;
        }, () -> false);
    }

    @Override
    public List<RecurringJobDefinition> listRecurring() {
        List<RecurringJobDefinition> definitions = new ArrayList<>();
        try (RocksIterator iter = transactionDB.newIterator(recurring, scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                definitions.add(RecurringJobSerializer.deserialize(iter.value()));
            }
        }
        return definitions;
    }

    @Override
    public List<String> queryDueRecurring(Instant now) {
        long millis = now.toEpochMilli();
        List<String> due = new ArrayList<>();
        for (RecurringJobDefinition definition : listRecurring()) {
            if (definition.isDue(millis)) {
                due.add(definition.getId());
            }
        }
        return due;
    }

    @Override
    public Optional<String> fireRecurring(String recurringId, Instant expectedNextFireAt, Instant newNextFireAt) {
        byte[] key = StorageKeys.recurringKey(recurringId);
        return execute("fireRecurring", txn -> {
            byte[] value = txn.getForUpdate(readOpts, recurring, key, true);
            if (value == null) {
                return Optional.<String>empty();
            }
            RecurringJobDefinition definition = RecurringJobSerializer.deserialize(value);
            if (definition.getNextFireAt() != expectedNextFireAt.toEpochMilli()) {
                return Optional.<String>empty();
            }
            String jobId = spawn(txn, definition);
            definition.recordFire(expectedNextFireAt.toEpochMilli(), newNextFireAt.toEpochMilli());
            txn.put(recurring, key, RecurringJobSerializer.serialize(definition));
            return Optional.of(jobId);
        }, Optional::empty);
    }

    @Override
    public Optional<String> triggerRecurring(String recurringId) {
        byte[] key = StorageKeys.recurringKey(recurringId);
        return execute("triggerRecurring", txn -> {
            byte[] value = txn.getForUpdate(readOpts, recurring, key, true);
            if (value == null) {
                return Optional.<String>empty();
            }
            RecurringJobDefinition definition = RecurringJobSerializer.deserialize(value);
            String jobId = spawn(txn, definition);
            definition.recordTrigger(clock.millis());
            txn.put(recurring, key, RecurringJobSerializer.serialize(definition));
            return Optional.of(jobId);
        }, Optional::empty);
    }

    private String spawn(Transaction txn, RecurringJobDefinition definition) throws RocksDBException {
        long now = clock.millis();
        JobRecord job = new JobRecord(UUID.randomUUID().toString(), definition.getPayload(), now, now,
                definition.getMaxAttempts(), definition.getTimeoutMillis());
        job.linkRecurring(definition.getId());
        job.moveTo(JobState.ENQUEUED, now);
        writeJob(txn, null, job);
        return job.getId();
    }

    // ========== Monitoring & maintenance ==========

    @Override
    public StoreMetrics getMetrics() {
        Map<JobState, Long> counts = new EnumMap<>(JobState.class);
        try (RocksIterator iter = transactionDB.newIterator(index, scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                JobState state = JobState.fromOrdinal(iter.key()[0]);
                counts.merge(state, 1L, Long::sum);
            }
        }
        return new StoreMetrics(counts, countKeys(recurring), countKeys(continuations));
    }

    @Override
    public List<JobRecord> recentFailures(int limit) {
        Deque<JobRecord> latest = new ArrayDeque<>();
        for (String jobId : scanIndex(JobState.FAILED, Long.MAX_VALUE, Integer.MAX_VALUE)) {
            Optional<JobRecord> job = find(jobId);
            if (job.isPresent() && job.get().isTerminal()) {
                latest.addFirst(job.get());
                if (latest.size() > limit) {
                    latest.removeLast();
                }
            }
        }
        return new ArrayList<>(latest);
    }

    @Override
    public List<JobRecord> listByState(JobState state, int limit) {
        List<JobRecord> result = new ArrayList<>();
        for (String jobId : scanIndex(state, Long.MAX_VALUE, limit)) {
            find(jobId).ifPresent(result::add);
        }
        return result;
    }

    @Override
    public long purgeFinished(Instant olderThan) {
        long cutoff = olderThan.toEpochMilli() - 1;
        long purged = 0;
        for (JobState state : new JobState[]{JobState.SUCCEEDED, JobState.DELETED}) {
            for (String jobId : scanIndex(state, cutoff, Integer.MAX_VALUE)) {
                if (hasContinuations(jobId)) {
                    continue;
                }
                boolean deleted = execute("purge", txn -> {
                    JobRecord job = readJobForUpdate(txn, jobId);
                    if (job == null || job.getState() != state || job.getLastModified() > cutoff) {
                        return false;
                    }
                    txn.delete(index, indexKeyOf(job));
                    txn.delete(jobs, StorageKeys.jobKey(jobId));
                    return true;
                }, () -> false);
                if (deleted) {
                    purged++;
                }
            }
        }
        if (purged > 0) {
            log.info("Purged {} finished jobs older than {}", purged, olderThan);
        }
        return purged;
    }

    /**
     * Number of optimistic transaction commits that lost a race.
     * Useful for monitoring contention.
     */
    public long getTransactionConflictCount() {
        return txnConflictCount.get();
    }

    @Override
    public void close() {
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        if (transactionDB != null) {
            transactionDB.close();
        }
        if (scanReadOpts != null) {
            scanReadOpts.close();
        }
        if (readOpts != null) {
            readOpts.close();
        }
        if (txnOpts != null) {
            txnOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        closeOptions();
    }

    private void closeOptions() {
        dbOptions.close();
        cfOptions.close();
        blockCache.close();
        bloomFilter.close();
    }

    // ========== Internals ==========

    @FunctionalInterface
    private interface TxnWork<R> {
        R apply(Transaction txn) throws RocksDBException;
    }

    /**
     * Runs {@code work} in an optimistic transaction, re-running it on commit
     * conflicts. Other storage errors become {@link StoreUnavailableException};
     * the transaction is discarded in that case, so nothing is half-written.
     */
    private <R> R execute(String operation, TxnWork<R> work, Supplier<R> onExhausted) {
        for (int attempt = 0; attempt <= MAX_CONFLICT_RETRIES; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
                R result = work.apply(txn);
                txn.commit();
                return result;
            } catch (RocksDBException e) {
                if (!isConflict(e)) {
                    throw unavailable(operation, e);
                }
                txnConflictCount.incrementAndGet();
            }
        }
        log.warn("{} gave up after {} conflicting commits", operation, MAX_CONFLICT_RETRIES + 1);
        return onExhausted.get();
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }

    private static StoreUnavailableException unavailable(String operation, RocksDBException e) {
        return new StoreUnavailableException("Job store " + operation + " failed: " + e.getMessage(), e);
    }

    private JobRecord readJobForUpdate(Transaction txn, String jobId) throws RocksDBException {
        byte[] value = txn.getForUpdate(readOpts, jobs, StorageKeys.jobKey(jobId), true);
        return value == null ? null : JobRecordSerializer.deserialize(value);
    }

    private void writeJob(Transaction txn, byte[] oldIndexKey, JobRecord job) throws RocksDBException {
        byte[] newIndexKey = indexKeyOf(job);
        if (oldIndexKey != null && !Arrays.equals(oldIndexKey, newIndexKey)) {
            txn.delete(index, oldIndexKey);
        }
        txn.put(index, newIndexKey, EMPTY);
        txn.put(jobs, StorageKeys.jobKey(job.getId()), JobRecordSerializer.serialize(job));
    }

    private static byte[] indexKeyOf(JobRecord job) {
        return StorageKeys.indexKey(job.getState(), indexTime(job), job.getId());
    }

    private static long indexTime(JobRecord job) {
        return switch (job.getState()) {
            case PROCESSING -> job.getLeaseExpiry();
            case SUCCEEDED, FAILED, DELETED -> job.getLastModified();
            default -> job.getScheduledFor();
        };
    }

    /**
     * Job ids of {@code state} with index time at or before {@code maxTime},
     * in index order.
     */
    private List<String> scanIndex(JobState state, long maxTime, int limit) {
        byte[] prefix = StorageKeys.indexPrefix(state);
        List<String> ids = new ArrayList<>();
        try (RocksIterator iter = transactionDB.newIterator(index, scanReadOpts)) {
            for (iter.seek(prefix); iter.isValid() && ids.size() < limit; iter.next()) {
                byte[] key = iter.key();
                if (!StorageKeys.hasPrefix(key, prefix) || StorageKeys.indexTime(key) > maxTime) {
                    break;
                }
                ids.add(StorageKeys.indexJobId(key));
            }
        }
        return ids;
    }

    private long countKeys(ColumnFamilyHandle family) {
        long count = 0;
        try (RocksIterator iter = transactionDB.newIterator(family, scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                count++;
            }
        }
        return count;
    }
}
