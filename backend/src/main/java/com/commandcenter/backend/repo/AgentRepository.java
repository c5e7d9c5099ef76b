package com.commandcenter.backend.repo;

import com.commandcenter.backend.config.DashboardProperties;
import com.commandcenter.backend.domain.Agent;
import com.commandcenter.backend.domain.AgentPatch;
import com.commandcenter.backend.domain.Timestamps;
import com.commandcenter.backend.service.storage.JsonCollectionStore;
import com.commandcenter.backend.service.storage.PersistentDocument;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Agents report their own status, so updates are upserts: an unknown id registers a new agent.
 * <p>
 * startedWorkingAt marks the start of the current busy stretch. It is stamped when an agent goes from a
 * resting label to a busy one, survives busy-to-busy changes (Working to Thinking) and is cleared on
 * Idle / Standby.
 */
@Component
public class AgentRepository {

    public static final String KEY = "agents";
    private static final TypeReference<List<Agent>> TYPE = new TypeReference<>() {};

    private final PersistentDocument<List<Agent>> doc;
    private final Clock clock;

    public AgentRepository(JsonCollectionStore store, Clock clock, DashboardProperties props) {
        this.doc = new PersistentDocument<>(store, KEY, TYPE, () -> seed(props.getSeedAgent()));
        this.clock = clock;
    }

    public List<Agent> findAll() {
        return Collections.unmodifiableList(doc.read());
    }

    public Agent upsert(String id, AgentPatch patch) {
        return doc.update(agents -> {
            String now = Timestamps.now(clock);
            String next = patch.newStatus();

            Agent target = agents.stream().filter(a -> id.equals(a.getId())).findFirst().orElse(null);
            if (target == null) {
                Agent created = new Agent();
                created.setId(id);
                patch.applyTo(created);
                if (Agent.isBusy(next)) created.setStartedWorkingAt(now);
                agents.add(created);
                return created;
            }

            String old = target.getStatus() == null ? "Idle" : target.getStatus();
            patch.applyTo(target);
            if (Agent.isBusy(next)) {
                if (!Agent.isBusy(old) || Timestamps.isBlank(target.getStartedWorkingAt())) {
                    target.setStartedWorkingAt(now);
                }
            } else if (next != null && Agent.RESTING_STATUSES.contains(next)) {
                target.setStartedWorkingAt(null);
            }
            return target;
        });
    }

    /** @return whether the agent existed */
    public boolean remove(String id) {
        return doc.update(agents -> agents.removeIf(a -> id.equals(a.getId())), removed -> removed);
    }

    private static List<Agent> seed(DashboardProperties.SeedAgent seed) {
        Agent manager = new Agent();
        manager.setId(seed.getId());
        manager.setName(seed.getName());
        manager.setModel(seed.getModel());
        manager.setRole(seed.getRole());
        manager.setStatus("Idle");
        manager.setStatusEmoji("");
        List<Agent> agents = new ArrayList<>();
        agents.add(manager);
        return agents;
    }
}
