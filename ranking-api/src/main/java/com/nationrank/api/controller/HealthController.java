package com.nationrank.api.controller;

import com.nationrank.api.repository.readonly.MatchReadRepository;
import com.nationrank.api.repository.readonly.PlayerReadRepository;
import com.nationrank.api.service.RankingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final MatchReadRepository matchRepository;
    private final PlayerReadRepository playerRepository;
    private final RankingService rankingService;

    public HealthController(
            MatchReadRepository matchRepository,
            PlayerReadRepository playerRepository,
            RankingService rankingService
    ) {
        this.matchRepository = matchRepository;
        this.playerRepository = playerRepository;
        this.rankingService = rankingService;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Match store connectivity and last published run")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("timestamp", Instant.now());

        try {
            health.put("matchCount", matchRepository.count());
            health.put("playerCount", playerRepository.count());
            health.put("matchStore", "OK");
        } catch (RuntimeException e) {
            health.put("matchStore", "ERROR: " + e.getMessage());
        }

        health.put("lastRun", rankingService.getPublishedRun()
                .map(run -> (Object) run.getCompletedAt())
                .orElse("none"));
        return health;
    }
}
