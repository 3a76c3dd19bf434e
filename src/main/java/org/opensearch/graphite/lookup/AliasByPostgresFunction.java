/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.lookup;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.graphite.common.ErrorKind;
import org.opensearch.graphite.common.GraphiteFunctionException;
import org.opensearch.graphite.core.model.MetricData;
import org.opensearch.graphite.core.model.MetricRequest;
import org.opensearch.graphite.core.utils.MetricPaths;
import org.opensearch.graphite.lang.graphite.expr.Expr;
import org.opensearch.graphite.query.function.Evaluator;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionParam;
import org.opensearch.graphite.query.function.FunctionType;
import org.opensearch.graphite.query.function.GraphiteFunction;
import org.opensearch.graphite.query.function.QueryContext;
import org.opensearch.graphite.query.function.SeriesArgs;

import java.io.Closeable;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code aliasByPostgres(seriesList, databaseName, keyString, *nodes)}: renames series from a SQL lookup.
 *
 * <h2>Lookup:</h2>
 * <p>The selected nodes of each metric path (negative indices count from the end, out of range ones are skipped)
 * feed the configured query: placeholder {@code <var_name><i>} is bound as a JDBC parameter to the i-th selected
 * node. The first column of the last returned row is the lookup result.</p>
 *
 * <h2>Naming:</h2>
 * <ul>
 *   <li>no result: the selected nodes joined with dots</li>
 *   <li>a result matching {@code match_string}: the result, followed by the selected nodes not bound to the query</li>
 *   <li>a result not matching: the series is dropped</li>
 * </ul>
 */
public class AliasByPostgresFunction implements GraphiteFunction, Closeable {

    public static final String NAME = "aliasByPostgres";

    private static final Logger logger = LogManager.getLogger(AliasByPostgresFunction.class);

    private final AliasByPostgresConfig config;
    private final Map<String, BoundedConnectionPool> pools;
    private final Map<String, PreparedLookup> lookups = new HashMap<>();

    public AliasByPostgresFunction(AliasByPostgresConfig config, Map<String, BoundedConnectionPool> pools) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.pools = Map.copyOf(pools);
        for (Map.Entry<String, AliasByPostgresConfig.Database> database : config.databases().entrySet()) {
            for (Map.Entry<String, AliasByPostgresConfig.KeyString> key : database.getValue().keyStrings().entrySet()) {
                lookups.put(lookupKey(database.getKey(), key.getKey()), PreparedLookup.of(key.getValue()));
            }
        }
    }

    @Override
    public List<MetricData> evaluate(
        Evaluator evaluator,
        QueryContext ctx,
        Expr expr,
        long from,
        long until,
        Map<MetricRequest, List<MetricData>> values
    ) {
        List<MetricData> args = SeriesArgs.firstSeriesArg(evaluator, ctx, expr, from, until, values);
        String databaseName = expr.stringArg(1);
        String keyString = expr.stringArg(2);
        List<Integer> fields = expr.intArgs(3);

        BoundedConnectionPool pool = pools.get(databaseName);
        PreparedLookup lookup = lookups.get(lookupKey(databaseName, keyString));
        if (pool == null || lookup == null) {
            throw GraphiteFunctionException.of(
                ErrorKind.INVALID_ARGUMENT,
                "unknown database [" + databaseName + "] or key string [" + keyString + "]"
            );
        }

        List<MetricData> result = new ArrayList<>(args.size());
        for (MetricData series : args) {
            String metric = MetricPaths.extractMetric(series.getName());
            if (metric.isEmpty()) {
                continue;
            }
            List<String> selected = selectNodes(MetricPaths.nodes(metric), fields);
            String alias = lookup.run(ctx, pool, selected);
            if (alias.isEmpty()) {
                result.add(series.withNameAndTag(String.join(".", selected)));
                continue;
            }
            if (!lookup.matches(alias)) {
                logger.debug("Lookup result [{}] for {} does not match, dropping it", alias, metric);
                continue;
            }
            List<String> rest = selected.subList(Math.min(lookup.boundNodes(), selected.size()), selected.size());
            String name = rest.isEmpty() ? alias : alias + "." + String.join(".", rest);
            result.add(series.withNameAndTag(name));
        }
        return result;
    }

    static List<String> selectNodes(String[] nodes, List<Integer> fields) {
        List<String> selected = new ArrayList<>(fields.size());
        for (int field : fields) {
            int index = field < 0 ? field + nodes.length : field;
            if (index >= 0 && index < nodes.length) {
                selected.add(nodes[index]);
            }
        }
        return selected;
    }

    private static String lookupKey(String database, String keyString) {
        return database + "/" + keyString;
    }

    @Override
    public void close() {
        for (BoundedConnectionPool pool : pools.values()) {
            pool.close();
        }
    }

    @Override
    public Map<String, FunctionDescription> description() {
        return Map.of(
            NAME,
            FunctionDescription.builder(NAME, "aliasByPostgres(seriesList, databaseName, keyString, *nodes)")
                .description(
                    "Takes a seriesList and renames every series with the result of a lookup in a configured "
                        + "PostgreSQL database, keyed by one or more nodes of the series name."
                )
                .group("Alias")
                .module("graphite.render.functions.custom")
                .param(FunctionParam.seriesList())
                .param(FunctionParam.of("databaseName", FunctionType.STRING).required().options(config.databases().keySet().toArray()))
                .param(FunctionParam.of("keyString", FunctionType.STRING).required())
                .param(FunctionParam.of("nodes", FunctionType.NODE_OR_TAG).required().multiple())
                .nameChange()
                .nameTagChange()
                .build()
        );
    }

    /**
     * A lookup query with its placeholders turned into JDBC parameters.
     *
     * @param sql query with {@code ?} parameters
     * @param parameterNodes selected node index bound to each parameter
     * @param boundNodes number of leading selected nodes consumed by the query
     * @param matchPattern pattern a result must contain
     */
    record PreparedLookup(String sql, List<Integer> parameterNodes, int boundNodes, Pattern matchPattern) {

        static PreparedLookup of(AliasByPostgresConfig.KeyString keyString) {
            Matcher matcher = Pattern.compile(Pattern.quote(keyString.varName()) + "(\\d+)").matcher(keyString.queryString());
            StringBuilder sql = new StringBuilder();
            List<Integer> parameterNodes = new ArrayList<>();
            int boundNodes = 0;
            while (matcher.find()) {
                int node = Integer.parseInt(matcher.group(1));
                parameterNodes.add(node);
                boundNodes = Math.max(boundNodes, node + 1);
                matcher.appendReplacement(sql, "?");
            }
            matcher.appendTail(sql);
            return new PreparedLookup(sql.toString(), List.copyOf(parameterNodes), boundNodes, Pattern.compile(keyString.matchString()));
        }

        boolean matches(String alias) {
            return matchPattern.matcher(alias).find();
        }

        String run(QueryContext ctx, BoundedConnectionPool pool, List<String> selected) {
            for (int node : parameterNodes) {
                if (node >= selected.size()) {
                    throw GraphiteFunctionException.of(
                        ErrorKind.INVALID_ARGUMENT,
                        "query needs node " + node + " but only " + selected.size() + " nodes were selected"
                    );
                }
            }
            try (BoundedConnectionPool.Lease lease = pool.acquire(ctx)) {
                try (PreparedStatement statement = lease.connection().prepareStatement(sql)) {
                    long timeoutSeconds = ctx.remainingMillis() == Long.MAX_VALUE ? 0 : Math.max(1, ctx.remainingMillis() / 1000);
                    statement.setQueryTimeout((int) Math.min(Integer.MAX_VALUE, timeoutSeconds));
                    for (int i = 0; i < parameterNodes.size(); i++) {
                        statement.setString(i + 1, selected.get(parameterNodes.get(i)));
                    }
                    String result = "";
                    try (ResultSet rows = statement.executeQuery()) {
                        while (rows.next()) {
                            String value = rows.getString(1);
                            result = value == null ? "" : value;
                        }
                    }
                    return result;
                } catch (SQLTimeoutException e) {
                    throw new GraphiteFunctionException(ErrorKind.TIMEOUT, "lookup in [" + pool.getName() + "] timed out", e);
                } catch (SQLException e) {
                    lease.markBroken();
                    throw new GraphiteFunctionException(ErrorKind.BACKEND_FAILURE, "lookup in [" + pool.getName() + "] failed", e);
                }
            }
        }
    }
}
