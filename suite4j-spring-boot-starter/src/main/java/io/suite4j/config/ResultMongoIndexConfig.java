package io.suite4j.config;

import io.suite4j.internal.mongo.ClassResultDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the result store.
 *
 * <p>Indexes are <b>not</b> created at startup unless
 * {@code suite4j.report.mongo.ensure-indexes-on-startup=true}. In production they are usually
 * managed by migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code suite_class_results})</h3>
 * <ul>
 *   <li><b>ux_run_classPath</b> (unique): { runId: 1, classPath: 1 }
 *       <br/>Backs the upsert of class results and keeps one document per class and run.</li>
 *   <li><b>idx_run_outcome</b>: { runId: 1, outcome: 1 }
 *       <br/>Used to list retired classes of a run.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.suite_class_results.createIndex({ runId: 1, classPath: 1 }, { name: "ux_run_classPath", unique: true });
 * db.suite_class_results.createIndex({ runId: 1, outcome: 1 }, { name: "idx_run_outcome" });
 * </pre>
 */
public class ResultMongoIndexConfig {

    public static final String UX_RUN_CLASS_PATH = "ux_run_classPath";
    public static final String IDX_RUN_OUTCOME = "idx_run_outcome";

    private final MongoTemplate mongoTemplate;

    public ResultMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ClassResultDocument.class).ensureIndex(runClassPathIndex());
        mongoTemplate.indexOps(ClassResultDocument.class).ensureIndex(runOutcomeIndex());
    }

    public static Index runClassPathIndex() {
        return new Index()
                .on("runId", Sort.Direction.ASC)
                .on("classPath", Sort.Direction.ASC)
                .unique()
                .named(UX_RUN_CLASS_PATH);
    }

    public static Index runOutcomeIndex() {
        return new Index()
                .on("runId", Sort.Direction.ASC)
                .on("outcome", Sort.Direction.ASC)
                .named(IDX_RUN_OUTCOME);
    }
}
