package com.commandcenter.backend.service.external;

import com.commandcenter.backend.config.DashboardProperties;
import com.commandcenter.backend.domain.Timestamps;
import com.commandcenter.backend.domain.memory.FactPage;
import com.commandcenter.backend.domain.memory.MemoryConversation;
import com.commandcenter.backend.domain.memory.MemoryFact;
import com.commandcenter.backend.domain.memory.MemoryGoal;
import com.commandcenter.backend.domain.memory.MemoryPreference;
import com.commandcenter.backend.domain.memory.MemoryStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only queries over the agents' long-term memory database (facts, goals, conversations, preferences).
 * A connection is opened per call; nothing here ever writes.
 */
@Component
public class MemoryStoreReader {

    private static final Logger log = LoggerFactory.getLogger(MemoryStoreReader.class);
    private static final DateTimeFormatter SQL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public static final int DEFAULT_FACT_LIMIT = 20;
    public static final int MAX_FACT_LIMIT = 100;
    public static final int DEFAULT_CONVERSATION_DAYS = 7;

    private final Path dbPath;
    private final Clock clock;

    @Autowired
    public MemoryStoreReader(DashboardProperties props, Clock clock) {
        this(props.getMemory().getDbPath(), clock);
    }

    public MemoryStoreReader(Path dbPath, Clock clock) {
        this.dbPath = dbPath;
        this.clock = clock;
    }

    public MemoryStats stats() {
        try (Connection conn = open()) {
            String today = Timestamps.today(clock).toString();
            String monthAgo = Timestamps.today(clock).minusDays(30).toString();
            return new MemoryStats(
                    count(conn, "SELECT COUNT(*) FROM facts"),
                    count(conn, "SELECT COUNT(*) FROM goals"),
                    count(conn, "SELECT COUNT(*) FROM goals WHERE status = 'active'"),
                    count(conn, "SELECT COUNT(*) FROM goals WHERE status = 'completed'"),
                    count(conn, "SELECT COUNT(*) FROM conversations"),
                    count(conn, "SELECT COUNT(*) FROM conversations WHERE DATE(created_at) = ?", today),
                    count(conn, "SELECT COUNT(*) FROM preferences"),
                    Files.size(dbPath),
                    grouped(conn, "SELECT category, COUNT(*) FROM facts GROUP BY category", "uncategorized"),
                    grouped(conn, "SELECT DATE(created_at) AS day, COUNT(*) FROM conversations "
                            + "WHERE DATE(created_at) >= ? GROUP BY DATE(created_at) ORDER BY day", null, monthAgo),
                    grouped(conn, "SELECT status, COUNT(*) FROM goals GROUP BY status", "unknown")
            );
        } catch (SQLException | IOException e) {
            throw failure("stats", e);
        }
    }

    public FactPage facts(int page, int limit) {
        int p = Math.max(1, page);
        int l = Math.max(1, Math.min(MAX_FACT_LIMIT, limit));
        try (Connection conn = open()) {
            int total = count(conn, "SELECT COUNT(*) FROM facts");
            List<MemoryFact> facts = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT id, fact, category, created_at FROM facts ORDER BY created_at DESC LIMIT ? OFFSET ?")) {
                ps.setInt(1, l);
                ps.setLong(2, (long) (p - 1) * l);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        facts.add(new MemoryFact(rs.getObject("id"), rs.getString("fact"),
                                rs.getString("category"), rs.getString("created_at")));
                    }
                }
            }
            return new FactPage(facts, total, p, l);
        } catch (SQLException e) {
            throw failure("facts", e);
        }
    }

    public List<MemoryGoal> goals() {
        try (Connection conn = open();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT id, text, deadline, status, priority, created_at, completed_at FROM goals ORDER BY created_at DESC");
             ResultSet rs = ps.executeQuery()) {
            List<MemoryGoal> out = new ArrayList<>();
            while (rs.next()) {
                out.add(new MemoryGoal(rs.getObject("id"), rs.getString("text"), rs.getString("deadline"),
                        rs.getString("status"), rs.getObject("priority"),
                        rs.getString("created_at"), rs.getString("completed_at")));
            }
            return out;
        } catch (SQLException e) {
            throw failure("goals", e);
        }
    }

    public List<MemoryConversation> conversations(int days) {
        String since = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(days).format(SQL_TIME);
        try (Connection conn = open();
             PreparedStatement ps = conn.prepareStatement(
                     "SELECT id, role, content, channel, session_id, created_at FROM conversations "
                             + "WHERE created_at >= ? ORDER BY created_at DESC")) {
            ps.setString(1, since);
            List<MemoryConversation> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new MemoryConversation(rs.getObject("id"), rs.getString("role"), rs.getString("content"),
                            rs.getString("channel"), rs.getString("session_id"), rs.getString("created_at")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw failure("conversations", e);
        }
    }

    public List<MemoryPreference> preferences() {
        try (Connection conn = open();
             PreparedStatement ps = conn.prepareStatement("SELECT key, value, updated_at FROM preferences ORDER BY key");
             ResultSet rs = ps.executeQuery()) {
            List<MemoryPreference> out = new ArrayList<>();
            while (rs.next()) {
                out.add(new MemoryPreference(rs.getString("key"), rs.getString("value"), rs.getString("updated_at")));
            }
            return out;
        } catch (SQLException e) {
            throw failure("preferences", e);
        }
    }

    private Connection open() throws SQLException {
        if (!Files.isRegularFile(dbPath)) {
            throw new MemoryStoreException("Memory store not found: " + dbPath);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        return config.createConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
    }

    private static int count(Connection conn, String sql, String... args) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) ps.setString(i + 1, args[i]);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private static Map<String, Integer> grouped(Connection conn, String sql, String nullLabel, String... args)
            throws SQLException {
        Map<String, Integer> out = new LinkedHashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) ps.setString(i + 1, args[i]);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String key = rs.getString(1);
                    out.merge(key == null ? nullLabel : key, rs.getInt(2), Integer::sum);
                }
            }
        }
        return out;
    }

    private MemoryStoreException failure(String view, Exception e) {
        log.warn("Memory store query '{}' failed on {}: {}", view, dbPath, e.getMessage());
        return new MemoryStoreException(e.getMessage(), e);
    }
}
