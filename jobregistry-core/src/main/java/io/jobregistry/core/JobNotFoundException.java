package io.jobregistry.core;

/**
 * Raised by a {@link io.jobregistry.JobStore} when no job exists for an id.
 */
public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("No job found for id: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
