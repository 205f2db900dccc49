package com.affiliation.linkage.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FalkorDB-specific implementation using the JFalkorDB client.
 * Query parameters are substituted into the query text as escaped literals.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

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
        String processed = substitute(query, params);
        log.trace("falkordb.execute query={}", processed);
        graph.query(processed);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processed = substitute(query, params);
        log.trace("falkordb.query query={}", processed);

        ResultSet resultSet = graph.query(processed);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }
        return results;
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndex(String label, String property) {
        InputSanitizer.validateIdentifier(label);
        InputSanitizer.validateIdentifier(property);
        String query = "CREATE INDEX FOR (n:" + label + ") ON (n." + property + ")";
        try {
            graph.query(query);
            log.info("falkordb.indexCreated label={} property={}", label, property);
        } catch (RuntimeException e) {
            // FalkorDB reports an error when the index already exists
            log.debug("falkordb.indexSkipped label={} property={} reason={}", label, property, e.getMessage());
        }
    }

    /**
     * Replaces {@code $name} placeholders with literal values in a single pass, so neither a
     * longer name sharing a prefix nor a value containing {@code $} is substituted twice.
     */
    static String substitute(String query, Map<String, Object> params) {
        Matcher matcher = PLACEHOLDER.matcher(query);
        StringBuilder sb = new StringBuilder(query.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name) ? literal(params.get(name)) : matcher.group();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("falkordb.closeFailed graph={}", graphName, e);
        }
        log.info("falkordb.closed graph={}", graphName);
    }
}
