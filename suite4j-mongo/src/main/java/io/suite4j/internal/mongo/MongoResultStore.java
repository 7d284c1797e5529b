package io.suite4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.suite4j.core.ClassReport;
import io.suite4j.core.DiscoveryFailure;
import io.suite4j.core.MethodResult;
import io.suite4j.core.RunSummary;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB persistence layer for run results.
 *
 * <p>Every write is an upsert keyed by {runId, classPath} (class results) or runId (runs), so
 * delivering the same report twice leaves a single document behind.
 */
public class MongoResultStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoResultStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Append one accepted method result to the class history.
     */
    public void appendMethodResult(String runId, String runnerId, MethodResult result) {
        Objects.requireNonNull(result, "result must not be null");

        Map<String, Object> entry = new LinkedHashMap<>(toMap(result));
        entry.put("runnerId", runnerId);
        entry.put("receivedAt", Date.from(Instant.now()));

        Update u = new Update().push("history", entry);

        mongoTemplate.upsert(classQuery(runId, result.classPath()), u, ClassResultDocument.class);
    }

    /**
     * Persist the terminal report of a class.
     *
     * @return true when no document existed for the class yet
     */
    public boolean saveClassResult(ClassReport report) {
        Objects.requireNonNull(report, "report must not be null");

        Update u = new Update();
        u.set("runId", report.runId());
        u.set("classPath", report.classPath());
        u.set("methods", report.methods());
        u.set("fixtureMethods", report.fixtureMethods());
        u.set("lastRunner", report.lastRunner());
        u.set("failureCount", report.failureCount());
        u.set("timeoutCount", report.timeoutCount());
        u.set("outcome", report.outcome());
        if (report.retiredReason() != null) {
            u.set("retiredReason", report.retiredReason());
        } else {
            u.unset("retiredReason");
        }
        u.set("results", report.results().stream().map(this::toMap).toList());
        u.set("finishedAt", report.finishedAt());

        UpdateResult result = mongoTemplate.upsert(classQuery(report.runId(), report.classPath()), u, ClassResultDocument.class);
        return result.getUpsertedId() != null;
    }

    public void saveDiscoveryFailure(String runId, DiscoveryFailure failure) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(failure, "failure must not be null");

        Update u = new Update().set("discoveryFailure", toMap(failure));
        mongoTemplate.upsert(runQuery(runId), u, RunReportDocument.class);
    }

    public void saveRun(RunSummary summary) {
        Objects.requireNonNull(summary, "summary must not be null");

        Update u = new Update()
                .set("reason", summary.reason())
                .set("discovered", summary.discovered())
                .set("completed", summary.completed())
                .set("retired", summary.retired())
                .set("abandoned", summary.abandoned())
                .set("runnersSeen", summary.runnersSeen())
                .set("startedAt", summary.startedAt())
                .set("finishedAt", summary.finishedAt());

        mongoTemplate.upsert(runQuery(summary.runId()), u, RunReportDocument.class);
    }

    public RunReportDocument findRun(String runId) {
        return mongoTemplate.findOne(runQuery(runId), RunReportDocument.class);
    }

    public ClassResultDocument findClassResult(String runId, String classPath) {
        return mongoTemplate.findOne(classQuery(runId, classPath), ClassResultDocument.class);
    }

    /**
     * All class results of a run, ordered by class path.
     */
    public List<ClassResultDocument> findClassResults(String runId) {
        Query q = new Query(Criteria.where("runId").is(runId))
                .with(Sort.by(Sort.Direction.ASC, "classPath"));
        return mongoTemplate.find(q, ClassResultDocument.class);
    }

    /**
     * Hard delete a run and its class results.
     *
     * @return deleted class result count
     */
    public long deleteRun(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        mongoTemplate.remove(runQuery(runId), RunReportDocument.class);
        return mongoTemplate.remove(new Query(Criteria.where("runId").is(runId)), ClassResultDocument.class)
                .getDeletedCount();
    }

    private static Query classQuery(String runId, String classPath) {
        return new Query(Criteria.where("runId").is(runId).and("classPath").is(classPath));
    }

    private static Query runQuery(String runId) {
        return new Query(Criteria.where("_id").is(runId));
    }

    private Map<String, Object> toMap(Object value) {
        return objectMapper.convertValue(value, MAP_TYPE);
    }
}
