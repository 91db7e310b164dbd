package com.nationrank.api.controller;

import com.nationrank.api.service.RankingService;
import com.nationrank.engine.leaderboard.PlayerLeaderboard;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/players")
@Tag(name = "Players", description = "Player leaderboards")
public class PlayerController {

    private final RankingService rankingService;

    public PlayerController(RankingService rankingService) {
        this.rankingService = rankingService;
    }

    @GetMapping("/{gameMode}")
    @Operation(summary = "Player leaderboard",
               description = "Top players by rating; restricted to one nation when country is given")
    public PlayerLeaderboard getLeaderboard(
            @PathVariable String gameMode,
            @Parameter(description = "Optional country code") @RequestParam(required = false) String country,
            @RequestParam(required = false) Integer days
    ) {
        return rankingService.getPlayerLeaderboard(gameMode, country, days);
    }
}
