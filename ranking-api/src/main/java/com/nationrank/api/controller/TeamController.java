package com.nationrank.api.controller;

import com.nationrank.api.service.TeamService;
import com.nationrank.engine.graph.PlayerPairEdge;
import com.nationrank.engine.team.DetectedTeam;
import com.nationrank.engine.team.TeamDetectionResult;
import com.nationrank.engine.team.TeamType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/teams")
@Tag(name = "Teams", description = "Party teams, communities and frequent pairs")
public class TeamController {

    private final TeamService teamService;

    public TeamController(TeamService teamService) {
        this.teamService = teamService;
    }

    @GetMapping("/pairs")
    @Operation(summary = "Frequent pairs", description = "Pairs that often share a side, with synergy")
    public List<PlayerPairEdge> getPairs(@RequestParam(required = false) Integer days) {
        return teamService.getFrequentPairs(days);
    }

    @GetMapping("/{teamType}")
    @Operation(summary = "Detected teams", description = "party: recurring party rosters; community: clusters of the co-occurrence graph")
    public TeamDetectionResult getTeams(
            @Parameter(description = "party or community") @PathVariable String teamType,
            @RequestParam(required = false) Integer days
    ) {
        return teamService.getTeams(TeamType.parse(teamType), days);
    }

    @GetMapping("/{teamType}/search")
    @Operation(summary = "Search teams by player", description = "Case-insensitive match on member name, or exact player id")
    public List<DetectedTeam> search(
            @PathVariable String teamType,
            @RequestParam String player,
            @RequestParam(required = false) Integer days
    ) {
        return teamService.searchTeams(TeamType.parse(teamType), player, days);
    }
}
