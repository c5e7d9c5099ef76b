package com.commandcenter.backend.domain.memory;

import java.util.List;

public record FactPage(List<MemoryFact> facts, int total, int page, int limit) {}
