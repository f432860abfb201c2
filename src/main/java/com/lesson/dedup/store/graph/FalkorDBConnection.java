package com.lesson.dedup.store.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * FalkorDB connection using the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("falkordb.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = substituteParams(query, params);
        log.debug("Executing: {}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = substituteParams(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }
        log.debug("Query returned {} rows", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("Creating indexes for lesson deduplication...");
        createIndex("CREATE INDEX FOR (l:Lesson) ON (l.lessonId)");
        createIndex("CREATE INDEX FOR (a:LessonArchive) ON (a.lessonId)");
        createIndex("CREATE INDEX FOR (a:LessonArchive) ON (a.canonicalId)");
        createIndex("CREATE INDEX FOR (d:ResolutionDecision) ON (d.canonicalId)");
        createIndex("CREATE INDEX FOR (g:GroupDismissal) ON (g.groupKey)");
        createIndex("CREATE INDEX FOR (c:CanonicalLink) ON (c.archivedLessonId)");
        createIndex("CREATE INDEX FOR (c:CanonicalLink) ON (c.canonicalId)");
        createIndex("CREATE INDEX FOR (p:UserProfile) ON (p.userId)");
        log.info("Index creation complete");
    }

    private void createIndex(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // FalkorDB rejects re-creating an existing index
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    /**
     * Substitutes {@code $name} placeholders with literal values. Longer names are replaced
     * first so that {@code $ids} is not clobbered by {@code $id}.
     */
    static String substituteParams(String query, Map<String, Object> params) {
        List<String> names = params.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        String result = query;
        for (String name : names) {
            result = result.replace("$" + name, formatValue(params.get(name)));
        }
        return result;
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .map(FalkorDBConnection::formatValue)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        return quote(value.toString());
    }

    private static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB connection", e);
        }
        log.info("FalkorDB connection closed");
    }
}
