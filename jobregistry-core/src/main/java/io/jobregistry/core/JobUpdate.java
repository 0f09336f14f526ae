package io.jobregistry.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fields to set on an existing job.
 *
 * <p>Only {@code date} and {@code complete} can change after creation, and {@code complete}
 * can only be set to {@code true}.
 */
public final class JobUpdate {

    private final Map<String, Object> fields;

    private JobUpdate(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static JobUpdate date(Instant date) {
        Objects.requireNonNull(date, "date must not be null");
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Job.FIELD_DATE, date);
        return new JobUpdate(fields);
    }

    public static JobUpdate markComplete() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Job.FIELD_COMPLETE, Boolean.TRUE);
        return new JobUpdate(fields);
    }

    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * Apply these fields to an in-memory job.
     */
    public Job applyTo(Job job) {
        Job updated = job;
        if (fields.containsKey(Job.FIELD_DATE)) {
            updated = updated.withDate((Instant) fields.get(Job.FIELD_DATE));
        }
        if (Boolean.TRUE.equals(fields.get(Job.FIELD_COMPLETE))) {
            updated = updated.markedComplete();
        }
        return updated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobUpdate other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
