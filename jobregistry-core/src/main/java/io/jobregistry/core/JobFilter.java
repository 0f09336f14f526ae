package io.jobregistry.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JobFilter describes which jobs a query should return.
 *
 * <p>This is an API-layer object (NOT a MongoDB query). Each store translates it into its own
 * query form. Conditions are combined with logical AND; an empty filter matches every job.
 *
 * <p>Paths are either top-level job fields ({@code type}, {@code date}, {@code complete},
 * {@code _id}) or dotted payload paths such as {@code data.articleId}.
 */
public final class JobFilter {

    public enum Operator {
        EQ,
        LTE
    }

    public record Condition(String path, Operator operator, Object value) {
        public Condition {
            Objects.requireNonNull(path, "path must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
        }
    }

    private final List<Condition> conditions;

    private JobFilter(List<Condition> conditions) {
        this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * Conceptual map form, e.g. {@code {type=repair, data.a=10}} or
     * {@code {date={lte=2024-01-01T00:00:00Z}, complete=false}}.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Condition c : conditions) {
            if (c.operator() == Operator.EQ) {
                map.put(c.path(), c.value());
            } else {
                Map<String, Object> cmp = new LinkedHashMap<>();
                cmp.put("lte", c.value());
                map.put(c.path(), cmp);
            }
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobFilter other)) return false;
        return conditions.equals(other.conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Condition> conditions = new ArrayList<>();

        public Builder type(String type) {
            return eq(Job.FIELD_TYPE, type);
        }

        public Builder complete(boolean complete) {
            return eq(Job.FIELD_COMPLETE, complete);
        }

        public Builder dateAtOrBefore(Instant instant) {
            Objects.requireNonNull(instant, "instant must not be null");
            conditions.add(new Condition(Job.FIELD_DATE, Operator.LTE, instant));
            return this;
        }

        /**
         * Add a single payload constraint: {@code data.<key> == value}.
         */
        public Builder data(String key, Object value) {
            Objects.requireNonNull(key, "key must not be null");
            if (key.isBlank()) {
                throw new JobValidationException("Payload match key must not be blank");
            }
            return eq(Job.FIELD_DATA + "." + key, value);
        }

        public Builder dataMatches(Map<String, Object> matches) {
            Objects.requireNonNull(matches, "matches must not be null");
            for (var e : matches.entrySet()) {
                data(e.getKey(), e.getValue());
            }
            return this;
        }

        public Builder eq(String path, Object value) {
            conditions.add(new Condition(path, Operator.EQ, value));
            return this;
        }

        public JobFilter build() {
            return new JobFilter(conditions);
        }
    }
}
