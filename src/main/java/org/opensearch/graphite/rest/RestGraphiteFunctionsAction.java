/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.rest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.client.node.NodeClient;
import org.opensearch.core.rest.RestStatus;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.graphite.query.function.FunctionDescription;
import org.opensearch.graphite.query.function.FunctionRegistry;
import org.opensearch.rest.BaseRestHandler;
import org.opensearch.rest.BytesRestResponse;
import org.opensearch.rest.RestRequest;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.opensearch.core.xcontent.ToXContent.EMPTY_PARAMS;
import static org.opensearch.rest.RestRequest.Method.GET;

/**
 * REST: GET /_graphite/functions (every function) or /_graphite/functions/{name} (one function).
 *
 * <p>The listing holds {@code functions}, keyed by name, and {@code disabled}, the opted out names with their reason.</p>
 */
public class RestGraphiteFunctionsAction extends BaseRestHandler {

    private static final Logger logger = LogManager.getLogger(RestGraphiteFunctionsAction.class);

    public static final String NAME = "graphite_functions_action";
    static final String ROUTE_PATH = "/_graphite/functions";
    static final String ROUTE_PATH_WITH_NAME = "/_graphite/functions/{name}";

    private final FunctionRegistry registry;

    public RestGraphiteFunctionsAction(FunctionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<Route> routes() {
        return List.of(new Route(GET, ROUTE_PATH), new Route(GET, ROUTE_PATH_WITH_NAME));
    }

    @Override
    protected RestChannelConsumer prepareRequest(RestRequest request, NodeClient client) throws IOException {
        String name = request.param("name");
        if (name == null || name.isEmpty()) {
            logger.debug("List {} graphite functions", registry.size());
            return channel -> channel.sendResponse(new BytesRestResponse(RestStatus.OK, listing(channel.newBuilder())));
        }

        FunctionDescription description = registry.description(name);
        if (description == null) {
            String reason = registry.disabledFunctions().get(name);
            String message = reason == null ? "Unknown function: " + name : "Function " + name + " is disabled: " + reason;
            return channel -> channel.sendResponse(new BytesRestResponse(RestStatus.NOT_FOUND, "text/plain", message));
        }
        return channel -> channel.sendResponse(
            new BytesRestResponse(RestStatus.OK, description.toXContent(channel.newBuilder(), EMPTY_PARAMS))
        );
    }

    XContentBuilder listing(XContentBuilder builder) throws IOException {
        builder.startObject();
        builder.startObject("functions");
        for (Map.Entry<String, FunctionDescription> entry : registry.descriptions().entrySet()) {
            builder.field(entry.getKey());
            entry.getValue().toXContent(builder, EMPTY_PARAMS);
        }
        builder.endObject();
        builder.startObject("disabled");
        for (Map.Entry<String, String> entry : registry.disabledFunctions().entrySet()) {
            builder.field(entry.getKey(), entry.getValue());
        }
        builder.endObject();
        builder.endObject();
        return builder;
    }
}
