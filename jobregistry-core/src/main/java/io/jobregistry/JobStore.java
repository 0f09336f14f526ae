package io.jobregistry;

import io.jobregistry.core.Job;
import io.jobregistry.core.JobFilter;
import io.jobregistry.core.JobUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Persistence primitives the registry delegates to.
 *
 * <p>Implementations throw {@link io.jobregistry.core.JobNotFoundException} from
 * {@link #update} and {@link #delete} when no job has the given id.
 */
public interface JobStore {

    /**
     * Insert a job and return it with its assigned id.
     */
    Job create(Job job);

    Optional<Job> read(String id);

    Job update(String id, JobUpdate update);

    void delete(String id);

    /**
     * Return all jobs matching every condition of the filter.
     */
    List<Job> find(JobFilter filter);
}
