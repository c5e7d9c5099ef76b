package com.commandcenter.backend.service;

import com.commandcenter.backend.domain.Agent;
import com.commandcenter.backend.domain.AgentPatch;
import com.commandcenter.backend.domain.EventType;
import com.commandcenter.backend.repo.AgentRepository;
import com.commandcenter.backend.service.realtime.DashboardBroadcaster;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class AgentService {

    private final AgentRepository agents;
    private final DashboardBroadcaster broadcaster;

    public AgentService(AgentRepository agents, DashboardBroadcaster broadcaster) {
        this.agents = agents;
        this.broadcaster = broadcaster;
    }

    public List<Agent> list() {
        return agents.findAll();
    }

    public Agent report(String id, AgentPatch patch) {
        Agent agent = agents.upsert(id, patch);
        broadcaster.broadcast(EventType.AGENT_UPDATED, agent);
        return agent;
    }

    public void remove(String id) {
        agents.remove(id);
        broadcaster.broadcast(EventType.AGENT_REMOVED, Map.of("id", id));
    }
}
