package com.commandcenter.backend.domain.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record MemoryStats(
        @JsonProperty("facts_count") int factsCount,
        @JsonProperty("goals_count") int goalsCount,
        @JsonProperty("active_goals") int activeGoals,
        @JsonProperty("completed_goals") int completedGoals,
        @JsonProperty("conversations_count") int conversationsCount,
        @JsonProperty("conversations_today") int conversationsToday,
        @JsonProperty("preferences_count") int preferencesCount,
        @JsonProperty("database_size_bytes") long databaseSizeBytes,
        @JsonProperty("facts_by_category") Map<String, Integer> factsByCategory,
        @JsonProperty("conversations_by_day") Map<String, Integer> conversationsByDay,
        @JsonProperty("goals_by_status") Map<String, Integer> goalsByStatus
) {}
