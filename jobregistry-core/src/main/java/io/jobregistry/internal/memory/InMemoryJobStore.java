package io.jobregistry.internal.memory;

import io.jobregistry.JobStore;
import io.jobregistry.core.Job;
import io.jobregistry.core.JobFilter;
import io.jobregistry.core.JobNotFoundException;
import io.jobregistry.core.JobUpdate;
import io.jobregistry.utils.FieldPaths;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link JobStore} for tests and embedders without a database.
 *
 * <p>Filters are evaluated with {@link FieldPaths}, so dotted payload paths behave the same way
 * they do against MongoDB for single-level and nested-map payloads.
 */
public class InMemoryJobStore implements JobStore {

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public Job create(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        Job stored = job.withId(UUID.randomUUID().toString());
        jobs.put(stored.id(), stored);
        return stored;
    }

    @Override
    public Optional<Job> read(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public Job update(String id, JobUpdate update) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(update, "update must not be null");
        Job updated = jobs.computeIfPresent(id, (k, existing) -> update.applyTo(existing));
        if (updated == null) {
            throw new JobNotFoundException(id);
        }
        return updated;
    }

    @Override
    public void delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (jobs.remove(id) == null) {
            throw new JobNotFoundException(id);
        }
    }

    @Override
    public List<Job> find(JobFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        List<Job> matched = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (matches(job, filter)) {
                matched.add(job);
            }
        }
        return matched;
    }

    public int size() {
        return jobs.size();
    }

    private static boolean matches(Job job, JobFilter filter) {
        Map<String, Object> fields = toFieldMap(job);
        for (JobFilter.Condition c : filter.conditions()) {
            boolean ok = switch (c.operator()) {
                case EQ -> FieldPaths.matchesEquals(fields, c.path(), c.value());
                case LTE -> FieldPaths.matchesAtMost(fields, c.path(), c.value());
            };
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Object> toFieldMap(Job job) {
        Map<String, Object> fields = new HashMap<>();
        fields.put(Job.FIELD_ID, job.id());
        fields.put(Job.FIELD_TYPE, job.type());
        fields.put(Job.FIELD_DATE, job.date());
        fields.put(Job.FIELD_DATA, job.data());
        fields.put(Job.FIELD_COMPLETE, job.complete());
        return fields;
    }
}
