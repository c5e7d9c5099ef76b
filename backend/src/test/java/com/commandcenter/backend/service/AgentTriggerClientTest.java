package com.commandcenter.backend.service;

import com.commandcenter.backend.config.DashboardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AgentTriggerClientTest {

    private DashboardProperties.Trigger config;
    private RestTemplate rest;
    private MockRestServiceServer server;
    private AgentTriggerClient client;

    @BeforeEach
    void setUp() {
        config = new DashboardProperties.Trigger();
        rest = new RestTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        client = new AgentTriggerClient(config, rest);
    }

    @Test
    void postsTaskIdToRunner() {
        server.expect(requestTo("http://127.0.0.1:3001/trigger-agent"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"taskId\":\"abc12345\"}"))
                .andRespond(withSuccess());

        client.notifyAssigned("abc12345");

        server.verify();
    }

    @Test
    void runnerFailureIsSwallowed() {
        server.expect(requestTo(config.getUrl())).andRespond(withServerError());

        assertThatCode(() -> client.notifyAssigned("abc12345")).doesNotThrowAnyException();
        server.verify();
    }

    @Test
    void disabledClientSendsNothing() {
        config.setEnabled(false);

        client.notifyAssigned("abc12345");

        server.verify();
    }

    @Test
    void onlyAgentPrefixedAssigneesQualify() {
        assertThat(AgentTriggerClient.isAgentAssignee("Agent:coder")).isTrue();
        assertThat(AgentTriggerClient.isAgentAssignee("Jarvis")).isFalse();
        assertThat(AgentTriggerClient.isAgentAssignee(null)).isFalse();
    }
}
