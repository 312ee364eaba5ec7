package io.jobclock.config;

import io.jobclock.internal.mongo.JobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the {@code jobs} collection.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code jobclock.ensure-indexes-on-startup=true}; in
 * production they usually come from migrations or ops scripts.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>idx_status_next_run</b>: { status: 1, next_run_at: 1 }
 *       <br/>Used when timers are rebuilt from active jobs at startup.</li>
 *   <li><b>idx_created_at</b>: { created_at: 1 }
 *       <br/>Used by the job listing.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.jobs.createIndex({ status: 1, next_run_at: 1 }, { name: "idx_status_next_run" });
 * db.jobs.createIndex({ created_at: 1 }, { name: "idx_created_at" });
 * </pre>
 */
public class JobClockMongoIndexConfig {

    public static final String IDX_STATUS_NEXT_RUN = "idx_status_next_run";
    public static final String IDX_CREATED_AT = "idx_created_at";

    private final MongoTemplate mongoTemplate;

    public JobClockMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(statusNextRunIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(createdAtIndex());
    }

    public static Index statusNextRunIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("next_run_at", Sort.Direction.ASC)
                .named(IDX_STATUS_NEXT_RUN);
    }

    public static Index createdAtIndex() {
        return new Index()
                .on("created_at", Sort.Direction.ASC)
                .named(IDX_CREATED_AT);
    }
}
