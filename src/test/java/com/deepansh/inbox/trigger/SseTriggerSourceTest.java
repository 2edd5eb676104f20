package com.deepansh.inbox.trigger;

import com.deepansh.inbox.config.AgentProperties;
import com.deepansh.inbox.config.CatalogProperties;
import com.deepansh.inbox.exception.SubscriptionConnectionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SseTriggerSourceTest {

    static final String STREAM_URL = "https://backend.example.com/triggers/stream";

    MockRestServiceServer server;
    SseTriggerSource source;

    @BeforeEach
    void setUp() {
        AgentProperties agentProperties = new AgentProperties();
        agentProperties.getTrigger().setStreamUrl(STREAM_URL);
        CatalogProperties catalogProperties = new CatalogProperties();
        catalogProperties.setApiKey("test-key");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        source = new SseTriggerSource(builder, agentProperties, catalogProperties);
    }

    @Test
    void forEachEvent_dataLinesJoinedPerEvent_heartbeatsSkipped() {
        String body = ": heartbeat\n\n"
                + "event: trigger\n"
                + "data: {\"id\":\"e1\"}\n\n"
                + "data: {\"id\":\n"
                + "data: \"e2\"}\n\n";
        server.expect(requestTo(STREAM_URL))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("x-api-key", "test-key"))
                .andExpect(header("Accept", MediaType.TEXT_EVENT_STREAM_VALUE))
                .andRespond(withSuccess(body, MediaType.TEXT_EVENT_STREAM));

        List<String> events = new ArrayList<>();
        try (TriggerConnection connection = source.open()) {
            assertThat(connection.isConnected()).isFalse();
            connection.forEachEvent(events::add);
            assertThat(connection.isConnected()).isTrue();
        }

        assertThat(events).containsExactly("{\"id\":\"e1\"}", "{\"id\":\n\"e2\"}");
        server.verify();
    }

    @Test
    void forEachEvent_errorStatus_subscriptionConnectionException() {
        server.expect(requestTo(STREAM_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        TriggerConnection connection = source.open();

        assertThatThrownBy(() -> connection.forEachEvent(raw -> { }))
                .isInstanceOf(SubscriptionConnectionException.class)
                .hasMessageContaining("401");
        assertThat(connection.isConnected()).isFalse();
    }

    @Test
    void forEachEvent_closedBeforeStart_deliversNothing() {
        server.expect(requestTo(STREAM_URL))
                .andRespond(withSuccess("data: {\"id\":\"e1\"}\n\n", MediaType.TEXT_EVENT_STREAM));

        List<String> events = new ArrayList<>();
        TriggerConnection connection = source.open();
        connection.close();
        connection.forEachEvent(events::add);

        assertThat(events).isEmpty();
    }
}
