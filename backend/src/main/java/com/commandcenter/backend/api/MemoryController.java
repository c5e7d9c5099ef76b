package com.commandcenter.backend.api;

import com.commandcenter.backend.domain.memory.FactPage;
import com.commandcenter.backend.domain.memory.MemoryConversation;
import com.commandcenter.backend.domain.memory.MemoryGoal;
import com.commandcenter.backend.domain.memory.MemoryPreference;
import com.commandcenter.backend.domain.memory.MemoryStats;
import com.commandcenter.backend.service.external.MemoryStoreReader;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/memory")
public class MemoryController {

    private final MemoryStoreReader memory;

    public MemoryController(MemoryStoreReader memory) {
        this.memory = memory;
    }

    @GetMapping("/stats")
    public MemoryStats stats() {
        return memory.stats();
    }

    @GetMapping("/facts")
    public FactPage facts(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "" + MemoryStoreReader.DEFAULT_FACT_LIMIT) int limit
    ) {
        return memory.facts(page, limit);
    }

    @GetMapping("/goals")
    public List<MemoryGoal> goals() {
        return memory.goals();
    }

    @GetMapping("/conversations")
    public List<MemoryConversation> conversations(
            @RequestParam(defaultValue = "" + MemoryStoreReader.DEFAULT_CONVERSATION_DAYS) int days
    ) {
        return memory.conversations(days);
    }

    @GetMapping("/preferences")
    public List<MemoryPreference> preferences() {
        return memory.preferences();
    }
}
