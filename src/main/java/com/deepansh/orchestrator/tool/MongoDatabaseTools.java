package com.deepansh.orchestrator.tool;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.BasicQuery;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link DatabaseTools} over MongoTemplate.
 *
 * Collection allowlists come from orchestrator.tools. ObjectIds in results
 * are rendered as hex strings so documents serialize cleanly to the stream
 * and to tool-call records.
 */
@Component
@Slf4j
public class MongoDatabaseTools implements DatabaseTools {

    private final MongoTemplate mongoTemplate;
    private final OrchestratorProperties.Tools config;

    public MongoDatabaseTools(MongoTemplate mongoTemplate, OrchestratorProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.config = properties.getTools();
    }

    @Override
    public QueryResult find(String collection, Map<String, Object> filter, int limit) {
        long start = System.nanoTime();
        String denied = checkReadable(collection);
        if (denied != null) {
            return QueryResult.error(denied, elapsedMs(start));
        }

        try {
            BasicQuery query = new BasicQuery(new Document(filter != null ? filter : Map.of()));
            if (limit > 0) {
                query.limit(limit);
            }
            List<Map<String, Object>> docs = mongoTemplate.find(query, Document.class, collection).stream()
                    .map(MongoDatabaseTools::toPlainMap)
                    .toList();
            double latency = elapsedMs(start);
            log.debug("{} [collection={}, count={}, latencyMs={}]", FIND, collection, docs.size(), latency);
            return QueryResult.ok(docs, latency);
        } catch (Exception e) {
            log.warn("{} failed [collection={}]: {}", FIND, collection, e.getMessage());
            return QueryResult.error(e.getMessage(), elapsedMs(start));
        }
    }

    @Override
    public QueryResult insert(String collection, Map<String, Object> document) {
        long start = System.nanoTime();
        if (!config.getWritableCollectionList().contains(collection)) {
            return QueryResult.error("Collection '" + collection + "' is not writable. Allowed: "
                    + config.getWritableCollectionList(), elapsedMs(start));
        }

        try {
            mongoTemplate.insert(new Document(document), collection);
            return QueryResult.written(1, elapsedMs(start));
        } catch (Exception e) {
            log.warn("{} failed [collection={}]: {}", INSERT, collection, e.getMessage());
            return QueryResult.error(e.getMessage(), elapsedMs(start));
        }
    }

    @Override
    public QueryResult aggregate(String collection, List<Map<String, Object>> pipeline) {
        long start = System.nanoTime();
        String denied = checkReadable(collection);
        if (denied != null) {
            return QueryResult.error(denied, elapsedMs(start));
        }

        try {
            List<Document> stages = pipeline.stream().map(Document::new).toList();
            List<Map<String, Object>> docs = new ArrayList<>();
            mongoTemplate.getCollection(collection).aggregate(stages)
                    .forEach(d -> docs.add(toPlainMap(d)));
            return QueryResult.ok(docs, elapsedMs(start));
        } catch (Exception e) {
            log.warn("{} failed [collection={}]: {}", AGGREGATE, collection, e.getMessage());
            return QueryResult.error(e.getMessage(), elapsedMs(start));
        }
    }

    private String checkReadable(String collection) {
        List<String> readable = config.getReadableCollectionList();
        if (!readable.isEmpty() && !readable.contains(collection)) {
            return "Collection '" + collection + "' is not readable. Allowed: " + readable;
        }
        return null;
    }

    private static Map<String, Object> toPlainMap(Document doc) {
        Map<String, Object> out = new LinkedHashMap<>();
        doc.forEach((k, v) -> out.put(k, v instanceof ObjectId id ? id.toHexString() : v));
        return out;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
