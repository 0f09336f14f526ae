package io.jobregistry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the job registry.
 */
@ConfigurationProperties(prefix = "job-registry")
public class JobRegistryProperties {
    private boolean enabled = true;
    private String collection = "jobs";
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
