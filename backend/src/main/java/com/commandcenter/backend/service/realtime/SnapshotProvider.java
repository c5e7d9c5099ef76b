package com.commandcenter.backend.service.realtime;

import com.commandcenter.backend.config.DashboardProperties;
import com.commandcenter.backend.domain.Snapshot;
import com.commandcenter.backend.repo.ActivityRepository;
import com.commandcenter.backend.repo.AgentRepository;
import com.commandcenter.backend.repo.TaskRepository;
import org.springframework.stereotype.Component;

@Component
public class SnapshotProvider {

    private final TaskRepository tasks;
    private final AgentRepository agents;
    private final ActivityRepository activity;
    private final int recentActivity;

    public SnapshotProvider(TaskRepository tasks, AgentRepository agents, ActivityRepository activity,
                            DashboardProperties props) {
        this.tasks = tasks;
        this.agents = agents;
        this.activity = activity;
        this.recentActivity = props.getSnapshotActivity();
    }

    public Snapshot snapshot() {
        return new Snapshot(tasks.findAll(), agents.findAll(), activity.recent(recentActivity));
    }
}
