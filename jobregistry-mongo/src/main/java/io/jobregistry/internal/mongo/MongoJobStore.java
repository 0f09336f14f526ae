package io.jobregistry.internal.mongo;

import io.jobregistry.JobStore;
import io.jobregistry.core.Job;
import io.jobregistry.core.JobFilter;
import io.jobregistry.core.JobNotFoundException;
import io.jobregistry.core.JobUpdate;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Filter semantics:
 * <ul>
 *   <li>EQ conditions become {@code {path: value}}; a map value is an embedded-document match,
 *       which MongoDB compares field by field in order</li>
 *   <li>LTE conditions become {@code {path: {$lte: value}}}</li>
 *   <li>dotted payload paths ({@code data.articleId}) are passed through as MongoDB dot notation</li>
 * </ul>
 *
 * <p>BSON dates hold milliseconds, so job dates are truncated to millisecond precision on
 * {@link #create} and {@link #update}; the returned job carries the stored value.
 */
public class MongoJobStore implements JobStore {

    public static final String DEFAULT_COLLECTION = "jobs";

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this(mongoTemplate, DEFAULT_COLLECTION);
    }

    public MongoJobStore(MongoTemplate mongoTemplate, String collection) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        Objects.requireNonNull(collection, "collection must not be null");
        if (collection.isBlank()) {
            throw new IllegalArgumentException("collection must not be blank");
        }
        this.collection = collection;
    }

    public String collection() {
        return collection;
    }

    @Override
    public Job create(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        JobDocument saved = mongoTemplate.insert(toDocument(job), collection);
        return toJob(saved);
    }

    @Override
    public Optional<Job> read(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, JobDocument.class, collection))
                .map(MongoJobStore::toJob);
    }

    /**
     * Applies the update with {@code findAndModify}, so a matched document counts as found even
     * when nothing changes (e.g. completing an already completed job).
     */
    @Override
    public Job update(String id, JobUpdate update) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(update, "update must not be null");

        Update u = new Update();
        for (Map.Entry<String, Object> field : update.fields().entrySet()) {
            u.set(field.getKey(), toStoredValue(field.getValue()));
        }

        JobDocument doc = mongoTemplate.findAndModify(
                byId(id),
                u,
                FindAndModifyOptions.options().returnNew(true),
                JobDocument.class,
                collection
        );
        if (doc == null) {
            throw new JobNotFoundException(id);
        }
        return toJob(doc);
    }

    /**
     * Hard delete job by document id.
     */
    @Override
    public void delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        long deleted = mongoTemplate.remove(byId(id), JobDocument.class, collection).getDeletedCount();
        if (deleted == 0) {
            throw new JobNotFoundException(id);
        }
    }

    @Override
    public List<Job> find(JobFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        List<JobDocument> docs = mongoTemplate.find(buildQuery(filter), JobDocument.class, collection);
        List<Job> jobs = new ArrayList<>(docs.size());
        for (JobDocument d : docs) {
            jobs.add(toJob(d));
        }
        return jobs;
    }

    static Query buildQuery(JobFilter filter) {
        if (filter.isEmpty()) {
            return new Query();
        }
        return new Query(buildCriteria(filter));
    }

    private static Criteria buildCriteria(JobFilter filter) {
        List<Criteria> parts = new ArrayList<>(filter.conditions().size());

        for (JobFilter.Condition c : filter.conditions()) {
            Criteria part = Criteria.where(c.path());
            parts.add(switch (c.operator()) {
                case EQ -> part.is(c.value());
                case LTE -> part.lte(c.value());
            });
        }

        if (parts.size() == 1) {
            return parts.get(0);
        }

        return new Criteria().andOperator(parts.toArray(new Criteria[0]));
    }

    private static Query byId(String id) {
        return new Query(Criteria.where(Job.FIELD_ID).is(id));
    }

    private static JobDocument toDocument(Job job) {
        JobDocument doc = new JobDocument();
        doc.setType(job.type());
        doc.setDate(truncate(job.date()));
        doc.setData(job.data());
        doc.setComplete(job.complete());
        return doc;
    }

    private static Object toStoredValue(Object value) {
        return value instanceof Instant instant ? truncate(instant) : value;
    }

    private static Instant truncate(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS);
    }

    private static Job toJob(JobDocument doc) {
        return new Job(doc.getId(), doc.getType(), doc.getDate(), doc.getData(), doc.isComplete());
    }
}
