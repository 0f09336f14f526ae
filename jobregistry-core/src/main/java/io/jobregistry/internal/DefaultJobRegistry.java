package io.jobregistry.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobregistry.JobRegistry;
import io.jobregistry.JobStore;
import io.jobregistry.core.Job;
import io.jobregistry.core.JobFilter;
import io.jobregistry.core.JobUpdate;
import io.jobregistry.core.JobValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Default {@link JobRegistry} that translates registry operations into {@link JobStore} calls.
 *
 * <p>Holds no mutable state, so one instance can be shared across threads. Store failures are
 * propagated unchanged and never retried.
 *
 * <p>Typical usage:
 * <pre>{@code
 * JobRegistry registry = new DefaultJobRegistry(store);
 * String id = registry.schedule("repair", Instant.now(), Map.of("articleId", 2));
 *
 * for (Job job : registry.getDue("repair")) {
 *     // run it, then
 *     registry.complete(job.id());
 * }
 * }</pre>
 */
public class DefaultJobRegistry implements JobRegistry {

    static final String INVALID_TYPE_MESSAGE = "Job type must be a non-blank string";
    static final String INVALID_DATE_MESSAGE = "Job date must be an instant";

    private final JobStore store;
    private final ObjectMapper objectMapper;
    private final Logger log;

    public DefaultJobRegistry(JobStore store) {
        this(store, new ObjectMapper());
    }

    public DefaultJobRegistry(JobStore store, ObjectMapper objectMapper) {
        this(store, objectMapper, LoggerFactory.getLogger(DefaultJobRegistry.class));
    }

    public DefaultJobRegistry(JobStore store, ObjectMapper objectMapper, Logger log) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.log = Objects.requireNonNull(log, "log must not be null");
    }

    @Override
    public String schedule(String type, Instant date, Object data) {
        if (type == null || type.isBlank()) {
            throw new JobValidationException(INVALID_TYPE_MESSAGE);
        }
        requireDate(date);

        Job job = store.create(Job.pending(type, date, toDataMap(data)));
        log.info("Job scheduled id={} date={}", job.id(), job.date());
        return job.id();
    }

    @Override
    public String schedule(String type, Instant date) {
        return schedule(type, date, null);
    }

    @Override
    public void reschedule(String id, Instant date) {
        requireDate(date);
        Objects.requireNonNull(id, "id must not be null");

        Job job = store.update(id, JobUpdate.date(date));
        log.info("Job rescheduled id={} date={}", job.id(), job.date());
    }

    @Override
    public void cancel(String id) {
        Objects.requireNonNull(id, "id must not be null");

        store.delete(id);
        log.info("Job cancelled id={}", id);
    }

    @Override
    public void complete(String id) {
        Objects.requireNonNull(id, "id must not be null");

        Job job = store.update(id, JobUpdate.markComplete());
        log.info("Job marked as complete id={}", job.id());
    }

    @Override
    public List<Job> getDue() {
        return getDue(JobFilter.builder());
    }

    @Override
    public List<Job> getDue(String type) {
        Objects.requireNonNull(type, "type must not be null");
        return getDue(JobFilter.builder().type(type));
    }

    private List<Job> getDue(JobFilter.Builder filter) {
        filter.dateAtOrBefore(nowInstant()).complete(false);

        List<Job> jobs = store.find(filter.build());
        log.info("{} due jobs found", jobs.size());
        return jobs;
    }

    @Override
    public List<Job> getCompleted() {
        return getCompleted(JobFilter.builder());
    }

    @Override
    public List<Job> getCompleted(String type) {
        Objects.requireNonNull(type, "type must not be null");
        return getCompleted(JobFilter.builder().type(type));
    }

    private List<Job> getCompleted(JobFilter.Builder filter) {
        filter.complete(true);

        List<Job> jobs = store.find(filter.build());
        log.info("{} completed jobs found", jobs.size());
        return jobs;
    }

    @Override
    public List<Job> find(Map<String, Object> propertyMatches) {
        return find(JobFilter.builder(), propertyMatches);
    }

    @Override
    public List<Job> find(String type, Map<String, Object> propertyMatches) {
        Objects.requireNonNull(type, "type must not be null");
        return find(JobFilter.builder().type(type), propertyMatches);
    }

    private List<Job> find(JobFilter.Builder builder, Map<String, Object> propertyMatches) {
        Objects.requireNonNull(propertyMatches, "propertyMatches must not be null");
        JobFilter filter = builder.dataMatches(propertyMatches).build();

        List<Job> jobs = store.find(filter);
        log.info("{} jobs found for query {}", jobs.size(), filter);
        return jobs;
    }

    @Override
    public Optional<Job> get(String id) {
        Objects.requireNonNull(id, "id must not be null");

        Optional<Job> job = store.read(id);
        log.debug("Job lookup id={} found={}", id, job.isPresent());
        return job;
    }

    /**
     * Utility: current registry time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    private static void requireDate(Instant date) {
        if (date == null) {
            throw new JobValidationException(INVALID_DATE_MESSAGE);
        }
    }

    private Map<String, Object> toDataMap(Object data) {
        if (data == null) {
            return new LinkedHashMap<>();
        }
        // Maps are stored as given so values such as Instant keep their type.
        if (data instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        return objectMapper.convertValue(data, new TypeReference<LinkedHashMap<String, Object>>() {
        });
    }
}
