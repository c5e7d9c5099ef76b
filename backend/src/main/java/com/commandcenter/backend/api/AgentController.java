package com.commandcenter.backend.api;

import com.commandcenter.backend.domain.Agent;
import com.commandcenter.backend.domain.AgentPatch;
import com.commandcenter.backend.service.AgentService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private final AgentService agents;

    public AgentController(AgentService agents) {
        this.agents = agents;
    }

    @GetMapping
    public List<Agent> list() {
        return agents.list();
    }

    /** Creates the agent when the id is new, so sub-agents can register themselves. */
    @PatchMapping("/{id}/status")
    public Map<String, Object> report(@PathVariable String id, @RequestBody AgentPatch patch) {
        agents.report(id, patch);
        return Map.of("ok", true);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> remove(@PathVariable String id) {
        agents.remove(id);
        return Map.of("ok", true);
    }
}
