package me.toymail.jobsync.store;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Job records, kept in memory and written whole to jobs.json after every change.
 * Callers only ever see copies.
 */
public class JobRecordStore {
    private static final Logger log = LoggerFactory.getLogger(JobRecordStore.class);
    static final String FILE_NAME = "jobs.json";

    private final JsonStore store;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, JobRecord> byId;

    public JobRecordStore(JsonStore store) {
        this(store, Clock.systemUTC());
    }

    public JobRecordStore(JsonStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Write access for one import. Records handed out here are live: mutate them through
     * {@link #modify} so the batch knows it has to persist.
     */
    public final class Batch {
        private boolean dirty;

        public Collection<JobRecord> records() {
            return Collections.unmodifiableCollection(byId.values());
        }

        public JobRecord insert(JobRecord record) {
            if (isBlank(record.company)) throw new ImportWriteException("company is required");
            if (isBlank(record.jobTitle)) throw new ImportWriteException("jobTitle is required");
            JobRecord r = record.copy();
            Instant now = clock.instant();
            if (isBlank(r.id)) r.id = UUID.randomUUID().toString();
            if (byId.containsKey(r.id)) throw new ImportWriteException("duplicate record id " + r.id);
            if (r.response == null) r.response = ResponseStatus.NO_RESPONSE;
            r.createdAt = now;
            r.updatedAt = now;
            byId.put(r.id, r);
            dirty = true;
            return r;
        }

        public JobRecord modify(String id, Consumer<JobRecord> change) {
            JobRecord r = byId.get(id);
            if (r == null) throw new ImportWriteException("record " + id + " no longer exists");
            change.accept(r);
            r.updatedAt = clock.instant();
            dirty = true;
            return r;
        }
    }

    public interface BatchWork<T> {
        T apply(Batch batch);
    }

    /**
     * Run {@code work} under the write lock and persist once at the end. If persisting fails the
     * in-memory state is rolled back and the IOException propagates.
     */
    public <T> T batch(BatchWork<T> work) throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, JobRecord> all = load();
            Map<String, JobRecord> snapshot = deepCopy(all);
            Batch b = new Batch();
            T result;
            try {
                result = work.apply(b);
            } catch (RuntimeException e) {
                byId = snapshot;
                throw e;
            }
            if (b.dirty) {
                try {
                    persist();
                } catch (IOException e) {
                    byId = snapshot;
                    throw e;
                }
            }
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<JobRecord> list() throws IOException {
        return find(r -> true);
    }

    public List<JobRecord> find(Predicate<JobRecord> filter) throws IOException {
        lock.readLock().lock();
        try {
            ensureLoadedUnderRead();
            List<JobRecord> out = new ArrayList<>();
            for (JobRecord r : byId.values()) {
                if (filter.test(r)) out.add(r.copy());
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<JobRecord> get(String id) throws IOException {
        lock.readLock().lock();
        try {
            ensureLoadedUnderRead();
            JobRecord r = byId.get(id);
            return r == null ? Optional.empty() : Optional.of(r.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<JobRecord> findPendingEnrichment() throws IOException {
        return find(r -> r.enrichmentPending);
    }

    public JobRecord save(JobRecord record) throws IOException {
        return batch(b -> {
            if (record.id != null && byId.containsKey(record.id)) {
                return b.modify(record.id, r -> overwrite(r, record)).copy();
            }
            return b.insert(record).copy();
        });
    }

    /**
     * Apply {@code change} to one record and persist. Empty when the record does not exist.
     */
    public Optional<JobRecord> update(String id, Consumer<JobRecord> change) throws IOException {
        return batch(b -> byId.containsKey(id)
                ? Optional.of(b.modify(id, change).copy())
                : Optional.<JobRecord>empty());
    }

    public boolean delete(String id) throws IOException {
        lock.writeLock().lock();
        try {
            load();
            if (byId.remove(id) == null) return false;
            persist();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void overwrite(JobRecord target, JobRecord src) {
        JobRecord c = src.copy();
        target.jobTitle = c.jobTitle;
        target.company = c.company;
        target.companyLocation = c.companyLocation;
        target.appliedAt = c.appliedAt;
        target.respondedAt = c.respondedAt;
        target.response = c.response;
        target.externalJobId = c.externalJobId;
        target.website = c.website;
        target.source = c.source;
        target.description = c.description;
        target.wagesMin = c.wagesMin;
        target.wagesMax = c.wagesMax;
        target.wageType = c.wageType;
        target.employmentType = c.employmentType;
        target.locationType = c.locationType;
        target.enrichmentPending = c.enrichmentPending;
        target.enrichedAt = c.enrichedAt;
        target.statusChecks = c.statusChecks;
        target.notes = c.notes;
    }

    private void ensureLoadedUnderRead() throws IOException {
        if (byId != null) return;
        // upgrade is not possible with ReentrantReadWriteLock; load under the write lock instead
        lock.readLock().unlock();
        lock.writeLock().lock();
        try {
            load();
        } finally {
            lock.readLock().lock();
            lock.writeLock().unlock();
        }
    }

    private Map<String, JobRecord> load() throws IOException {
        if (byId == null) {
            List<JobRecord> stored = store.readJson(FILE_NAME, new TypeReference<List<JobRecord>>() {});
            Map<String, JobRecord> m = new LinkedHashMap<>();
            if (stored != null) {
                for (JobRecord r : stored) {
                    if (r.statusChecks == null) r.statusChecks = new ArrayList<>();
                    m.put(r.id, r);
                }
            }
            byId = m;
            log.debug("Loaded {} job records", m.size());
        }
        return byId;
    }

    private void persist() throws IOException {
        store.writeJson(FILE_NAME, new ArrayList<>(byId.values()));
    }

    private static Map<String, JobRecord> deepCopy(Map<String, JobRecord> m) {
        Map<String, JobRecord> out = new LinkedHashMap<>();
        for (Map.Entry<String, JobRecord> e : m.entrySet()) out.put(e.getKey(), e.getValue().copy());
        return out;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
