package com.nationrank.api.controller;

import com.nationrank.api.dto.RunSummary;
import com.nationrank.api.exception.ResourceNotFoundException;
import com.nationrank.api.service.RankingService;
import com.nationrank.engine.RankingRun;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rankings/runs")
@Tag(name = "Ranking runs", description = "Batch computation of every game mode")
public class RankingRunController {

    private final RankingService rankingService;

    public RankingRunController(RankingService rankingService) {
        this.rankingService = rankingService;
    }

    @PostMapping
    @Operation(summary = "Run and publish", description = "Recompute all game modes; failed modes keep their previous results")
    public RunSummary run(@RequestParam(required = false) Integer days) {
        return RunSummary.from(rankingService.runAndPublish(days));
    }

    @GetMapping("/latest")
    @Operation(summary = "Latest published run", description = "Full leaderboards of the last published run")
    public RankingRun latest() {
        return rankingService.getPublishedRun()
                .orElseThrow(() -> new ResourceNotFoundException("No ranking run has been published yet"));
    }
}
