package com.lesson.dedup.store.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database holding lessons and their resolution history.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher write.
     *
     * @param query  the Cypher query, with {@code $name} placeholders
     * @param params values for the placeholders
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns each row as a column-name to value map.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the lookup indexes used by the content store if they do not exist.
     */
    void createIndexes();

    @Override
    void close();
}
