package com.nationrank.api.config;

import com.nationrank.engine.EngineSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

@ConfigurationProperties(prefix = "ranking")
public class RankingProperties {

    private int windowDays = 7;
    private boolean rankedOnly = true;
    private int playerMinGames = 5;
    private int topContributors = 3;
    private int playerLeaderboardSize = 50;
    private List<String> factionCodes = new ArrayList<>();
    private List<String> knownNationCodes = new ArrayList<>();
    private int workerThreads = 4;
    private Teams teams = new Teams();

    /**
     * Engine settings equivalent to these properties.
     *
     * @throws IllegalArgumentException if the thresholds are inconsistent
     */
    public EngineSettings toEngineSettings() {
        return EngineSettings.builder()
                .playerMinGames(playerMinGames)
                .topContributors(topContributors)
                .playerLeaderboardSize(playerLeaderboardSize)
                .factionCodes(new HashSet<>(factionCodes))
                .knownNationCodes(new HashSet<>(knownNationCodes))
                .workerThreads(workerThreads)
                .minRosterSize(teams.minRosterSize)
                .maxRosterSize(teams.maxRosterSize)
                .minTeamMatches(teams.minTeamMatches)
                .teamResultLimit(teams.resultLimit)
                .communityMinEdgeWeight(teams.communityMinEdgeWeight)
                .communityMaxSize(teams.communityMaxSize)
                .cohesionMinGames(teams.cohesionMinGames)
                .cohesionMinFraction(teams.cohesionMinFraction)
                .pairMinWeight(teams.pairMinWeight)
                .partyOnlyGraph(teams.partyOnlyGraph)
                .build();
    }

    public int getWindowDays() { return windowDays; }
    public void setWindowDays(int windowDays) { this.windowDays = windowDays; }

    public boolean isRankedOnly() { return rankedOnly; }
    public void setRankedOnly(boolean rankedOnly) { this.rankedOnly = rankedOnly; }

    public int getPlayerMinGames() { return playerMinGames; }
    public void setPlayerMinGames(int playerMinGames) { this.playerMinGames = playerMinGames; }

    public int getTopContributors() { return topContributors; }
    public void setTopContributors(int topContributors) { this.topContributors = topContributors; }

    public int getPlayerLeaderboardSize() { return playerLeaderboardSize; }
    public void setPlayerLeaderboardSize(int playerLeaderboardSize) { this.playerLeaderboardSize = playerLeaderboardSize; }

    public List<String> getFactionCodes() { return factionCodes; }
    public void setFactionCodes(List<String> factionCodes) { this.factionCodes = factionCodes; }

    public List<String> getKnownNationCodes() { return knownNationCodes; }
    public void setKnownNationCodes(List<String> knownNationCodes) { this.knownNationCodes = knownNationCodes; }

    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

    public Teams getTeams() { return teams; }
    public void setTeams(Teams teams) { this.teams = teams; }

    public static class Teams {

        private int minRosterSize = 2;
        private int maxRosterSize = 10;
        private int minTeamMatches = 1;
        private int resultLimit = 100;
        private int communityMinEdgeWeight = 2;
        private int communityMaxSize = 50;
        private int cohesionMinGames = 5;
        private double cohesionMinFraction = 0.0;
        private int pairMinWeight = 3;
        private boolean partyOnlyGraph = false;

        public int getMinRosterSize() { return minRosterSize; }
        public void setMinRosterSize(int minRosterSize) { this.minRosterSize = minRosterSize; }

        public int getMaxRosterSize() { return maxRosterSize; }
        public void setMaxRosterSize(int maxRosterSize) { this.maxRosterSize = maxRosterSize; }

        public int getMinTeamMatches() { return minTeamMatches; }
        public void setMinTeamMatches(int minTeamMatches) { this.minTeamMatches = minTeamMatches; }

        public int getResultLimit() { return resultLimit; }
        public void setResultLimit(int resultLimit) { this.resultLimit = resultLimit; }

        public int getCommunityMinEdgeWeight() { return communityMinEdgeWeight; }
        public void setCommunityMinEdgeWeight(int communityMinEdgeWeight) { this.communityMinEdgeWeight = communityMinEdgeWeight; }

        public int getCommunityMaxSize() { return communityMaxSize; }
        public void setCommunityMaxSize(int communityMaxSize) { this.communityMaxSize = communityMaxSize; }

        public int getCohesionMinGames() { return cohesionMinGames; }
        public void setCohesionMinGames(int cohesionMinGames) { this.cohesionMinGames = cohesionMinGames; }

        public double getCohesionMinFraction() { return cohesionMinFraction; }
        public void setCohesionMinFraction(double cohesionMinFraction) { this.cohesionMinFraction = cohesionMinFraction; }

        public int getPairMinWeight() { return pairMinWeight; }
        public void setPairMinWeight(int pairMinWeight) { this.pairMinWeight = pairMinWeight; }

        public boolean isPartyOnlyGraph() { return partyOnlyGraph; }
        public void setPartyOnlyGraph(boolean partyOnlyGraph) { this.partyOnlyGraph = partyOnlyGraph; }
    }
}
