package io.jobregistry.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobregistry.JobRegistry;
import io.jobregistry.JobStore;
import io.jobregistry.internal.DefaultJobRegistry;
import io.jobregistry.internal.mongo.MongoJobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Spring Boot auto-configuration entrypoint for job registry components.
 */
@AutoConfiguration
@ConditionalOnClass({JobRegistry.class, MongoTemplate.class})
@EnableConfigurationProperties(JobRegistryProperties.class)
@ConditionalOnProperty(prefix = "job-registry", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobRegistryConfig {

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore(MongoTemplate mongoTemplate, JobRegistryProperties props) {
        return new MongoJobStore(mongoTemplate, props.getCollection());
    }

    @Bean
    @ConditionalOnMissingBean
    protected JobRegistryMongoIndexConfig jobRegistryMongoIndexConfig(MongoTemplate mongoTemplate,
                                                                      JobRegistryProperties props) {
        return new JobRegistryMongoIndexConfig(mongoTemplate, props.getCollection());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRegistry jobRegistry(JobStore jobStore, ObjectProvider<ObjectMapper> objectMapper) {
        return new DefaultJobRegistry(jobStore, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnProperty(prefix = "job-registry", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton jobRegistryIndexesInitializer(JobRegistryMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
