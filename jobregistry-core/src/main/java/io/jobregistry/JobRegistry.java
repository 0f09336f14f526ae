package io.jobregistry;

import io.jobregistry.core.Job;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main registry API.
 *
 * <p>Records typed, dated jobs in a {@link JobStore} and answers queries over them:
 * <ul>
 *   <li>due jobs: {@code date <= now} and not yet completed</li>
 *   <li>completed jobs</li>
 *   <li>jobs whose payload fields match given values</li>
 * </ul>
 *
 * <p>The registry does not run jobs. A separate worker consults it to decide what to run.
 */
public interface JobRegistry {

    /**
     * Persist a new job and return its store-assigned id.
     *
     * @param data arbitrary payload; converted to a field map before persisting
     */
    String schedule(String type, Instant date, Object data);

    String schedule(String type, Instant date);

    /**
     * Move the job's date. Fails with the store's error if the job does not exist.
     */
    void reschedule(String id, Instant date);

    /**
     * Remove the job permanently.
     */
    void cancel(String id);

    /**
     * Mark the job as complete. Completed jobs are never returned by {@link #getDue()}.
     */
    void complete(String id);

    /**
     * Uncompleted jobs whose date has been reached, across all types. No ordering guarantee.
     */
    List<Job> getDue();

    List<Job> getDue(String type);

    List<Job> getCompleted();

    List<Job> getCompleted(String type);

    /**
     * Jobs whose payload satisfies every {@code data.<key> == value} constraint.
     */
    List<Job> find(Map<String, Object> propertyMatches);

    List<Job> find(String type, Map<String, Object> propertyMatches);

    Optional<Job> get(String id);
}
