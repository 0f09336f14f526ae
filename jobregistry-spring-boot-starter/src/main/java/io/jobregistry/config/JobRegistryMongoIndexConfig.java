package io.jobregistry.config;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.util.Collection;
import java.util.Objects;

/**
 * MongoDB index definitions for the job registry.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created automatically unless
 * {@code job-registry.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <h3>Recommended indexes (collection: {@code jobs})</h3>
 * <ul>
 *   <li><b>idx_due</b>: { complete: 1, date: 1, type: 1 }
 *       <br/>Used by due-job queries, with or without a type.</li>
 *   <li><b>idx_type_complete</b>: { type: 1, complete: 1 }
 *       <br/>Used by completed-job queries and typed payload lookups.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.jobs.createIndex({ complete: 1, date: 1, type: 1 }, { name: "idx_due" });
 * db.jobs.createIndex({ type: 1, complete: 1 }, { name: "idx_type_complete" });
 * </pre>
 */
public class JobRegistryMongoIndexConfig {

    public static final String IDX_DUE = "idx_due";
    public static final String IDX_TYPE_COMPLETE = "idx_type_complete";

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public JobRegistryMongoIndexConfig(MongoTemplate mongoTemplate, String collection) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
    }

    public void ensureIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(collection);
        ops.createIndex(dueIndex());
        ops.createIndex(typeCompleteIndex());
    }

    /**
     * Keys: complete ASC, date ASC, type ASC
     */
    public static Index dueIndex() {
        return new Index()
                .on("complete", Sort.Direction.ASC)
                .on("date", Sort.Direction.ASC)
                .on("type", Sort.Direction.ASC)
                .named(IDX_DUE);
    }

    /**
     * Keys: type ASC, complete ASC
     */
    public static Index typeCompleteIndex() {
        return new Index()
                .on("type", Sort.Direction.ASC)
                .on("complete", Sort.Direction.ASC)
                .named(IDX_TYPE_COMPLETE);
    }

    /**
     * Build an index over payload fields, for deployments that query {@code find} on a fixed set
     * of keys.
     *
     * <p>Given dataKeys ["articleId"], the index keys become {@code { "data.articleId": 1 }}.
     *
     * @param indexName index name
     * @param dataKeys  keys under the {@code data} field
     */
    public static Index payloadIndex(String indexName, Collection<String> dataKeys) {
        Objects.requireNonNull(indexName, "indexName must not be null");
        Objects.requireNonNull(dataKeys, "dataKeys must not be null");
        if (dataKeys.isEmpty()) {
            throw new IllegalArgumentException("dataKeys must not be empty");
        }

        Index idx = new Index();
        for (String k : dataKeys) {
            if (k == null || k.isBlank()) {
                throw new IllegalArgumentException("dataKeys must not contain blank values");
            }
            idx = idx.on("data." + k, Sort.Direction.ASC);
        }
        return idx.named(indexName);
    }
}
