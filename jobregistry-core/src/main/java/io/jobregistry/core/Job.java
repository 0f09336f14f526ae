package io.jobregistry.core;

import io.jobregistry.utils.FieldPaths;

import java.time.Instant;
import java.util.Map;

/**
 * A persisted job.
 *
 * <p>{@code id} is null until the store assigns one. {@code data} is an unmodifiable deep copy,
 * so a payload cannot change once the job exists.
 */
public record Job(
        String id,
        String type,
        Instant date,
        Map<String, Object> data,
        boolean complete
) {

    public static final String FIELD_ID = "_id";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_DATE = "date";
    public static final String FIELD_DATA = "data";
    public static final String FIELD_COMPLETE = "complete";

    public Job {
        data = data == null ? Map.of() : FieldPaths.immutableCopy(data);
    }

    /**
     * A not-yet-persisted, uncompleted job.
     */
    public static Job pending(String type, Instant date, Map<String, Object> data) {
        return new Job(null, type, date, data, false);
    }

    public Job withId(String id) {
        return new Job(id, type, date, data, complete);
    }

    public Job withDate(Instant date) {
        return new Job(id, type, date, data, complete);
    }

    public Job markedComplete() {
        return new Job(id, type, date, data, true);
    }
}
