package com.commandcenter.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * dashboard.* settings from application.yml.
 */
@ConfigurationProperties(prefix = "dashboard")
public class DashboardProperties {

    /** Directory holding one JSON document per collection. */
    private Path dataDir = Path.of("data");

    private int activityCap = 500;

    /** Activity entries included in the connect snapshot. */
    private int snapshotActivity = 50;

    /** Attribution for completed tasks with no assignee. */
    private String defaultAgentName = "Jarvis";

    private SeedAgent seedAgent = new SeedAgent();
    private Archive archive = new Archive();
    private Feed feed = new Feed();
    private Memory memory = new Memory();
    private SystemScripts system = new SystemScripts();
    private Trigger trigger = new Trigger();
    private WebSocket websocket = new WebSocket();

    public Path getDataDir() { return dataDir; }
    public void setDataDir(Path dataDir) { this.dataDir = dataDir; }

    public int getActivityCap() { return activityCap; }
    public void setActivityCap(int activityCap) { this.activityCap = activityCap; }

    public int getSnapshotActivity() { return snapshotActivity; }
    public void setSnapshotActivity(int snapshotActivity) { this.snapshotActivity = snapshotActivity; }

    public String getDefaultAgentName() { return defaultAgentName; }
    public void setDefaultAgentName(String defaultAgentName) { this.defaultAgentName = defaultAgentName; }

    public SeedAgent getSeedAgent() { return seedAgent; }
    public void setSeedAgent(SeedAgent seedAgent) { this.seedAgent = seedAgent; }

    public Archive getArchive() { return archive; }
    public void setArchive(Archive archive) { this.archive = archive; }

    public Feed getFeed() { return feed; }
    public void setFeed(Feed feed) { this.feed = feed; }

    public Memory getMemory() { return memory; }
    public void setMemory(Memory memory) { this.memory = memory; }

    public SystemScripts getSystem() { return system; }
    public void setSystem(SystemScripts system) { this.system = system; }

    public Trigger getTrigger() { return trigger; }
    public void setTrigger(Trigger trigger) { this.trigger = trigger; }

    public WebSocket getWebsocket() { return websocket; }
    public void setWebsocket(WebSocket websocket) { this.websocket = websocket; }

    /** Written to the agents document when none exists yet. */
    public static class SeedAgent {
        private String id = "manager";
        private String name = "Jarvis";
        private String model = "default";
        private String role = "manager";

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
    }

    public static class Archive {
        /** Done tasks completed longer ago than this are archived. */
        private Duration after = Duration.ofDays(7);
        private boolean sweepEnabled = true;
        private long sweepIntervalMs = 3_600_000L;

        public Duration getAfter() { return after; }
        public void setAfter(Duration after) { this.after = after; }

        public boolean isSweepEnabled() { return sweepEnabled; }
        public void setSweepEnabled(boolean sweepEnabled) { this.sweepEnabled = sweepEnabled; }

        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
    }

    public static class Feed {
        private int capacity = 5000;

        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
    }

    public static class Memory {
        private Path dbPath = Path.of("..", "data", "memory.db");

        public Path getDbPath() { return dbPath; }
        public void setDbPath(Path dbPath) { this.dbPath = dbPath; }
    }

    public static class SystemScripts {
        private Path healthScript = Path.of("..", "scripts", "health-check.sh");
        private Path usageScript = Path.of("..", "scripts", "usage-tracker.sh");
        private Duration healthTimeout = Duration.ofSeconds(10);
        private Duration usageTimeout = Duration.ofSeconds(15);

        public Path getHealthScript() { return healthScript; }
        public void setHealthScript(Path healthScript) { this.healthScript = healthScript; }

        public Path getUsageScript() { return usageScript; }
        public void setUsageScript(Path usageScript) { this.usageScript = usageScript; }

        public Duration getHealthTimeout() { return healthTimeout; }
        public void setHealthTimeout(Duration healthTimeout) { this.healthTimeout = healthTimeout; }

        public Duration getUsageTimeout() { return usageTimeout; }
        public void setUsageTimeout(Duration usageTimeout) { this.usageTimeout = usageTimeout; }
    }

    public static class Trigger {
        private boolean enabled = true;
        private String url = "http://127.0.0.1:3001/trigger-agent";
        private Duration timeout = Duration.ofSeconds(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class WebSocket {
        private int sendTimeLimitMs = 10_000;
        private int bufferSizeLimit = 512 * 1024;
        private String[] allowedOrigins = {"*"};

        public int getSendTimeLimitMs() { return sendTimeLimitMs; }
        public void setSendTimeLimitMs(int sendTimeLimitMs) { this.sendTimeLimitMs = sendTimeLimitMs; }

        public int getBufferSizeLimit() { return bufferSizeLimit; }
        public void setBufferSizeLimit(int bufferSizeLimit) { this.bufferSizeLimit = bufferSizeLimit; }

        public String[] getAllowedOrigins() { return allowedOrigins; }
        public void setAllowedOrigins(String[] allowedOrigins) { this.allowedOrigins = allowedOrigins; }
    }
}
