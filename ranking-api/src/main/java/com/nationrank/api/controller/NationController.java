package com.nationrank.api.controller;

import com.nationrank.api.service.RankingService;
import com.nationrank.engine.leaderboard.NationLeaderboard;
import com.nationrank.engine.leaderboard.NationScoreExplanation;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/nations")
@Tag(name = "Nations", description = "Confidence-corrected nation leaderboards")
public class NationController {

    private final RankingService rankingService;

    public NationController(RankingService rankingService) {
        this.rankingService = rankingService;
    }

    @GetMapping("/{gameMode}")
    @Operation(summary = "Nation leaderboard",
               description = "Nations ranked by (wins - losses) / (games + CF) * 10000. Nations below k/4 games are left out.")
    public NationLeaderboard getLeaderboard(
            @Parameter(description = "Game mode, e.g. Duel or Team") @PathVariable String gameMode,
            @Parameter(description = "Window length in days", example = "7") @RequestParam(required = false) Integer days
    ) {
        return rankingService.getNationLeaderboard(gameMode, days);
    }

    @GetMapping("/{gameMode}/{countryCode}/explain")
    @Operation(summary = "Explain a nation's score",
               description = "Raw and adjusted score, k, CF, activity gate and per-player net wins")
    public NationScoreExplanation explain(
            @PathVariable String gameMode,
            @Parameter(description = "Two-letter country code or faction code") @PathVariable String countryCode,
            @RequestParam(required = false) Integer days
    ) {
        return rankingService.explainNationScore(gameMode, countryCode, days);
    }
}
