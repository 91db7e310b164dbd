package com.nationrank.api.service;

import com.nationrank.engine.RankingEngine;
import com.nationrank.engine.graph.PlayerPairEdge;
import com.nationrank.engine.team.DetectedTeam;
import com.nationrank.engine.team.TeamDetectionResult;
import com.nationrank.engine.team.TeamType;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TeamService {

    private final RankingService rankingService;
    private final RankingEngine engine;

    public TeamService(RankingService rankingService, RankingEngine engine) {
        this.rankingService = rankingService;
        this.engine = engine;
    }

    public TeamDetectionResult getTeams(TeamType type, Integer days) {
        return engine.buildTeams(rankingService.snapshot(days), type);
    }

    public List<DetectedTeam> searchTeams(TeamType type, String player, Integer days) {
        return engine.searchTeams(rankingService.snapshot(days), type, player);
    }

    public List<PlayerPairEdge> getFrequentPairs(Integer days) {
        return engine.frequentPairs(rankingService.snapshot(days));
    }
}
