/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.graphite.rest;

import org.opensearch.client.node.NodeClient;
import org.opensearch.core.rest.RestStatus;
import org.opensearch.graphite.query.function.FunctionRegistry;
import org.opensearch.graphite.utils.GraphiteTestUtils;
import org.opensearch.rest.RestHandler.Route;
import org.opensearch.rest.RestRequest;
import org.opensearch.test.OpenSearchTestCase;
import org.opensearch.test.rest.FakeRestChannel;
import org.opensearch.test.rest.FakeRestRequest;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.mockito.Mockito.mock;

public class RestGraphiteFunctionsActionTests extends OpenSearchTestCase {

    private FunctionRegistry registry;
    private RestGraphiteFunctionsAction action;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        registry = GraphiteTestUtils.registry();
        action = new RestGraphiteFunctionsAction(registry);
    }

    public void testRoutes() {
        // Act
        List<Route> routes = action.routes();

        // Assert
        assertEquals(2, routes.size());
        assertEquals(RestRequest.Method.GET, routes.get(0).getMethod());
        assertEquals("/_graphite/functions", routes.get(0).getPath());
        assertEquals("/_graphite/functions/{name}", routes.get(1).getPath());
        assertEquals("graphite_functions_action", action.getName());
    }

    public void testListsFunctionsAndDisabledOnes() throws Exception {
        // Arrange
        FakeRestRequest request = request("/_graphite/functions", Map.of());
        FakeRestChannel channel = new FakeRestChannel(request, true, 1);

        // Act
        action.handleRequest(request, channel, mock(NodeClient.class));

        // Assert
        assertThat(channel.capturedResponse().status(), equalTo(RestStatus.OK));
        String body = channel.capturedResponse().content().utf8ToString();
        assertThat(body, containsString("\"functions\":{\"absolute\":{"));
        assertThat(body, containsString("\"timeShiftByMetric\":{"));
        assertThat(body, containsString("\"disabled\":{\"aliasByPostgres\":\"test\"}"));
    }

    public void testDescribesOneFunction() throws Exception {
        // Arrange
        FakeRestRequest request = request("/_graphite/functions/scale", Map.of("name", "scale"));
        FakeRestChannel channel = new FakeRestChannel(request, true, 1);

        // Act
        action.handleRequest(request, channel, mock(NodeClient.class));

        // Assert
        assertThat(channel.capturedResponse().status(), equalTo(RestStatus.OK));
        String body = channel.capturedResponse().content().utf8ToString();
        assertThat(body, containsString("\"function\":\"scale(seriesList, factor)\""));
        assertThat(body, containsString("\"name\":\"scale\""));
    }

    public void testUnknownFunctionIsNotFound() throws Exception {
        // Arrange
        FakeRestRequest request = request("/_graphite/functions/nope", Map.of("name", "nope"));
        FakeRestChannel channel = new FakeRestChannel(request, true, 1);

        // Act
        action.handleRequest(request, channel, mock(NodeClient.class));

        // Assert
        assertThat(channel.capturedResponse().status(), equalTo(RestStatus.NOT_FOUND));
        assertEquals("Unknown function: nope", channel.capturedResponse().content().utf8ToString());
    }

    public void testDisabledFunctionIsNotFoundWithReason() throws Exception {
        // Arrange
        FakeRestRequest request = request("/_graphite/functions/aliasByPostgres", Map.of("name", "aliasByPostgres"));
        FakeRestChannel channel = new FakeRestChannel(request, true, 1);

        // Act
        action.handleRequest(request, channel, mock(NodeClient.class));

        // Assert
        assertThat(channel.capturedResponse().status(), equalTo(RestStatus.NOT_FOUND));
        assertEquals("Function aliasByPostgres is disabled: test", channel.capturedResponse().content().utf8ToString());
    }

    private FakeRestRequest request(String path, Map<String, String> params) {
        return new FakeRestRequest.Builder(xContentRegistry()).withMethod(RestRequest.Method.GET)
            .withPath(path)
            .withParams(new HashMap<>(params))
            .build();
    }
}
