package io.jobregistry.internal;

import io.jobregistry.JobRegistry;
import io.jobregistry.core.Job;
import io.jobregistry.core.JobNotFoundException;
import io.jobregistry.core.JobValidationException;
import io.jobregistry.internal.memory.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end registry behavior over {@link InMemoryJobStore}.
 */
class JobRegistryScenarioTest {

    private static final Instant PAST = Instant.parse("2010-02-03T00:00:00Z");

    private InMemoryJobStore store;
    private JobRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        registry = new DefaultJobRegistry(store);
    }

    @Test
    void scheduleShouldPersistJobWithGivenFields() {
        Instant date = Instant.now();

        String id = registry.schedule("repair", date, Map.of("articleId", "7"));

        Job job = registry.get(id).orElseThrow();
        assertEquals(id, job.id());
        assertEquals("repair", job.type());
        assertEquals(date, job.date());
        assertEquals(Map.of("articleId", "7"), job.data());
        assertFalse(job.complete());
    }

    @Test
    void invalidScheduleShouldNotMutateStore() {
        assertThrows(JobValidationException.class, () -> registry.schedule(null, Instant.now(), Map.of()));
        assertThrows(JobValidationException.class, () -> registry.schedule("repair", null, Map.of()));

        assertEquals(0, store.size());
    }

    @Test
    void rescheduleShouldUpdateTheDate() {
        Instant updated = Instant.parse("2014-04-05T00:00:00Z");
        String id = registry.schedule("repair", Instant.now());

        registry.reschedule(id, updated);

        assertEquals(updated, registry.get(id).orElseThrow().date());
    }

    @Test
    void rescheduleShouldFailForUnknownJob() {
        assertThrows(JobNotFoundException.class, () -> registry.reschedule("123", Instant.now()));
    }

    @Test
    void cancelShouldRemoveTheJob() {
        String id = registry.schedule("repair", Instant.now());

        registry.cancel(id);

        assertTrue(registry.get(id).isEmpty());
    }

    @Test
    void cancelShouldFailForUnknownJob() {
        assertThrows(JobNotFoundException.class, () -> registry.cancel("abc"));
    }

    @Test
    void completeShouldSetCompleteFlag() {
        String id = registry.schedule("repair", Instant.now());

        registry.complete(id);

        assertTrue(registry.get(id).orElseThrow().complete());
    }

    @Test
    void completeShouldBeRepeatable() {
        String id = registry.schedule("repair", Instant.now());

        registry.complete(id);
        registry.complete(id);

        assertTrue(registry.get(id).orElseThrow().complete());
    }

    @Test
    void completeShouldFailForUnknownJob() {
        assertThrows(JobNotFoundException.class, () -> registry.complete("abc"));
    }

    @Test
    void getDueShouldReturnOnlyJobsDatedInThePast() {
        List<String> pastIds = scheduleMany(6, "repair", PAST);
        scheduleMany(4, "repair", fiveYearsAhead());

        List<Job> due = registry.getDue();

        assertEquals(6, due.size());
        assertEquals(Set.copyOf(pastIds), ids(due));
    }

    @Test
    void getDueWithTypeShouldReturnOnlyMatchingType() {
        List<String> pastRepairIds = scheduleMany(6, "repair", PAST);
        scheduleMany(5, "clearCache", PAST);
        scheduleMany(4, "repair", fiveYearsAhead());

        List<Job> due = registry.getDue("repair");

        assertEquals(6, due.size());
        assertEquals(Set.copyOf(pastRepairIds), ids(due));
    }

    @Test
    void getDueShouldNotReturnCompletedJobs() {
        scheduleMany(6, "repair", PAST).forEach(registry::complete);
        scheduleMany(5, "clearCache", PAST).forEach(registry::complete);
        scheduleMany(4, "repair", fiveYearsAhead());

        assertTrue(registry.getDue("repair").isEmpty());
        assertTrue(registry.getDue().isEmpty());
    }

    @Test
    void getDueShouldIncludeJobsDatedExactlyNow() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        DefaultJobRegistry fixedClock = new DefaultJobRegistry(store) {
            @Override
            protected Instant nowInstant() {
                return now;
            }
        };
        String id = fixedClock.schedule("repair", now);

        assertEquals(Set.of(id), ids(fixedClock.getDue()));
    }

    @Test
    void getCompletedShouldReturnOnlyCompletedJobs() {
        scheduleMany(6, "repair", Instant.now());
        List<String> completed = scheduleMany(4, "repair", Instant.now());
        completed.forEach(registry::complete);

        List<Job> jobs = registry.getCompleted();

        assertEquals(4, jobs.size());
        assertEquals(Set.copyOf(completed), ids(jobs));
    }

    @Test
    void getCompletedWithTypeShouldReturnOnlyMatchingType() {
        scheduleMany(6, "repair", Instant.now());
        List<String> repairs = scheduleMany(5, "repair", Instant.now());
        repairs.forEach(registry::complete);
        scheduleMany(4, "clearCache", Instant.now()).forEach(registry::complete);

        List<Job> jobs = registry.getCompleted("repair");

        assertEquals(5, jobs.size());
        assertEquals(Set.copyOf(repairs), ids(jobs));
    }

    @Test
    void findShouldMatchPayloadFields() {
        List<String> ids = new ArrayList<>();
        for (int n = 0; n < 6; n++) {
            ids.add(registry.schedule("repair", Instant.now(), Map.of("articleId", String.valueOf(n))));
        }

        List<Job> results = registry.find(Map.of("articleId", "2"));

        assertEquals(1, results.size());
        assertEquals(ids.get(2), results.get(0).id());
    }

    @Test
    void findShouldCombineTypeAndAllPayloadConstraints() {
        String match = registry.schedule("repair", Instant.now(), Map.of("a", 10, "b", "abc"));
        registry.schedule("repair", Instant.now(), Map.of("a", 10, "b", "xyz"));
        registry.schedule("clearCache", Instant.now(), Map.of("a", 10, "b", "abc"));

        List<Job> results = registry.find("repair", Map.of("a", 10, "b", "abc"));

        assertEquals(Set.of(match), ids(results));
    }

    @Test
    void findShouldCompareNestedObjectsAsWholeValues() {
        String match = registry.schedule("repair", Instant.now(),
                Map.of("owner", Map.of("id", 1, "team", "ops")));
        registry.schedule("repair", Instant.now(),
                Map.of("owner", Map.of("id", 1, "team", "ops", "extra", true)));

        assertEquals(Set.of(match), ids(registry.find(Map.of("owner", Map.of("id", 1, "team", "ops")))));
        assertEquals(2, registry.find(Map.of("owner.team", "ops")).size());
    }

    @Test
    void returnedPayloadsShouldNotAlterStoredJobs() {
        Map<String, Object> owner = new LinkedHashMap<>();
        owner.put("team", "ops");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("articleId", "2");
        payload.put("owner", owner);
        registry.schedule("repair", Instant.now(), payload);

        payload.put("articleId", "999");
        owner.put("team", "dev");
        Job found = registry.find(Map.of("articleId", "2")).get(0);

        assertThrows(UnsupportedOperationException.class, () -> found.data().put("articleId", "999"));
        @SuppressWarnings("unchecked")
        Map<String, Object> storedOwner = (Map<String, Object>) found.data().get("owner");
        assertThrows(UnsupportedOperationException.class, () -> storedOwner.put("team", "dev"));
        assertEquals(1, registry.find(Map.of("articleId", "2")).size());
        assertEquals(1, registry.find(Map.of("owner.team", "ops")).size());
    }

    @Test
    void findShouldCompareNestedNumbersByValue() {
        String id = registry.schedule("repair", Instant.now(), Map.of("owner", Map.of("id", 1)));

        assertEquals(Set.of(id), ids(registry.find(Map.of("owner", Map.of("id", 1L)))));
        assertEquals(Set.of(id), ids(registry.find(Map.of("owner.id", 1L))));
    }

    private List<String> scheduleMany(int count, String type, Instant date) {
        List<String> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ids.add(registry.schedule(type, date, Map.of()));
        }
        return ids;
    }

    private static Instant fiveYearsAhead() {
        return ZonedDateTime.now(ZoneOffset.UTC).plusYears(5).toInstant();
    }

    private static Set<String> ids(List<Job> jobs) {
        return jobs.stream().map(Job::id).collect(Collectors.toSet());
    }
}
