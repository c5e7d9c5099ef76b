package com.commandcenter.backend.api;

import com.commandcenter.backend.api.dto.MoodRequest;
import com.commandcenter.backend.domain.Mood;
import com.commandcenter.backend.service.MoodService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/mood")
public class MoodController {

    private final MoodService mood;

    public MoodController(MoodService mood) {
        this.mood = mood;
    }

    @GetMapping
    public Mood get() {
        return mood.get();
    }

    @PostMapping
    public Mood set(@Valid @RequestBody MoodRequest req) {
        return mood.set(req.mood);
    }
}
