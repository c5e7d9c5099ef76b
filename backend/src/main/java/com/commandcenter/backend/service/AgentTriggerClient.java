package com.commandcenter.backend.service;

import com.commandcenter.backend.config.AsyncConfig;
import com.commandcenter.backend.config.DashboardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Tells the agent runner that a task was handed to an automated agent. Fire-and-forget: the runner
 * also polls, so a failed call is only logged.
 */
@Component
public class AgentTriggerClient {

    private static final Logger log = LoggerFactory.getLogger(AgentTriggerClient.class);
    private static final String AGENT_PREFIX = "Agent:";

    private final RestTemplate restTemplate;
    private final DashboardProperties.Trigger config;

    @Autowired
    public AgentTriggerClient(DashboardProperties props) {
        this(props.getTrigger(), restTemplate(props.getTrigger()));
    }

    public AgentTriggerClient(DashboardProperties.Trigger config, RestTemplate restTemplate) {
        this.config = config;
        this.restTemplate = restTemplate;
    }

    public static boolean isAgentAssignee(String assignedTo) {
        return assignedTo != null && assignedTo.startsWith(AGENT_PREFIX);
    }

    @Async(AsyncConfig.TRIGGER_EXECUTOR)
    public void notifyAssigned(String taskId) {
        if (!config.isEnabled()) return;
        try {
            restTemplate.postForEntity(config.getUrl(), Map.of("taskId", taskId), Void.class);
            log.debug("Agent trigger sent for task {}", taskId);
        } catch (RestClientException e) {
            log.warn("Agent trigger failed for task {} (runner will poll): {}", taskId, e.getMessage());
        }
    }

    private static RestTemplate restTemplate(DashboardProperties.Trigger config) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) config.getTimeout().toMillis());
        factory.setReadTimeout((int) config.getTimeout().toMillis());
        return new RestTemplate(factory);
    }
}
