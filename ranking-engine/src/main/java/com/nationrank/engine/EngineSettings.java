package com.nationrank.engine;

import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Thresholds and limits of a ranking run. Immutable; build with {@link #builder()}.
 */
public final class EngineSettings {

    private final int playerMinGames;
    private final int topContributors;
    private final int playerLeaderboardSize;
    private final Set<String> factionCodes;
    private final Set<String> knownNationCodes;

    private final int minRosterSize;
    private final int maxRosterSize;
    private final int minTeamMatches;
    private final int teamResultLimit;
    private final int communityMinEdgeWeight;
    private final int communityMaxSize;
    private final int cohesionMinGames;
    private final double cohesionMinFraction;
    private final int pairMinWeight;
    private final boolean partyOnlyGraph;

    private final int workerThreads;

    private EngineSettings(Builder b) {
        this.playerMinGames = b.playerMinGames;
        this.topContributors = b.topContributors;
        this.playerLeaderboardSize = b.playerLeaderboardSize;
        this.factionCodes = normalize(b.factionCodes);
        this.knownNationCodes = normalize(b.knownNationCodes);
        this.minRosterSize = b.minRosterSize;
        this.maxRosterSize = b.maxRosterSize;
        this.minTeamMatches = b.minTeamMatches;
        this.teamResultLimit = b.teamResultLimit;
        this.communityMinEdgeWeight = b.communityMinEdgeWeight;
        this.communityMaxSize = b.communityMaxSize;
        this.cohesionMinGames = b.cohesionMinGames;
        this.cohesionMinFraction = b.cohesionMinFraction;
        this.pairMinWeight = b.pairMinWeight;
        this.partyOnlyGraph = b.partyOnlyGraph;
        this.workerThreads = b.workerThreads;
    }

    public static EngineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Set<String> normalize(Set<String> codes) {
        return codes.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(c -> c.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.collectingAndThen(Collectors.toCollection(TreeSet::new), Collections::unmodifiableSet));
    }

    public int getPlayerMinGames() { return playerMinGames; }
    public int getTopContributors() { return topContributors; }
    public int getPlayerLeaderboardSize() { return playerLeaderboardSize; }
    public Set<String> getFactionCodes() { return factionCodes; }
    public Set<String> getKnownNationCodes() { return knownNationCodes; }
    public int getMinRosterSize() { return minRosterSize; }
    public int getMaxRosterSize() { return maxRosterSize; }
    public int getMinTeamMatches() { return minTeamMatches; }
    public int getTeamResultLimit() { return teamResultLimit; }
    public int getCommunityMinEdgeWeight() { return communityMinEdgeWeight; }
    public int getCommunityMaxSize() { return communityMaxSize; }
    public int getCohesionMinGames() { return cohesionMinGames; }
    public double getCohesionMinFraction() { return cohesionMinFraction; }
    public int getPairMinWeight() { return pairMinWeight; }
    public boolean isPartyOnlyGraph() { return partyOnlyGraph; }
    public int getWorkerThreads() { return workerThreads; }

    public static class Builder {
        private int playerMinGames = 5;
        private int topContributors = 3;
        private int playerLeaderboardSize = 50;
        private Set<String> factionCodes = Set.of();
        private Set<String> knownNationCodes = Set.of();
        private int minRosterSize = 2;
        private int maxRosterSize = 10;
        private int minTeamMatches = 1;
        private int teamResultLimit = 100;
        private int communityMinEdgeWeight = 2;
        private int communityMaxSize = 50;
        private int cohesionMinGames = 5;
        private double cohesionMinFraction = 0.0;
        private int pairMinWeight = 3;
        private boolean partyOnlyGraph = false;
        private int workerThreads = 4;

        public Builder playerMinGames(int v) { this.playerMinGames = v; return this; }
        public Builder topContributors(int v) { this.topContributors = v; return this; }
        public Builder playerLeaderboardSize(int v) { this.playerLeaderboardSize = v; return this; }
        public Builder factionCodes(Set<String> v) { this.factionCodes = v != null ? v : Set.of(); return this; }
        public Builder knownNationCodes(Set<String> v) { this.knownNationCodes = v != null ? v : Set.of(); return this; }
        public Builder minRosterSize(int v) { this.minRosterSize = v; return this; }
        public Builder maxRosterSize(int v) { this.maxRosterSize = v; return this; }
        public Builder minTeamMatches(int v) { this.minTeamMatches = v; return this; }
        public Builder teamResultLimit(int v) { this.teamResultLimit = v; return this; }
        public Builder communityMinEdgeWeight(int v) { this.communityMinEdgeWeight = v; return this; }
        public Builder communityMaxSize(int v) { this.communityMaxSize = v; return this; }
        public Builder cohesionMinGames(int v) { this.cohesionMinGames = v; return this; }
        public Builder cohesionMinFraction(double v) { this.cohesionMinFraction = v; return this; }
        public Builder pairMinWeight(int v) { this.pairMinWeight = v; return this; }
        public Builder partyOnlyGraph(boolean v) { this.partyOnlyGraph = v; return this; }
        public Builder workerThreads(int v) { this.workerThreads = v; return this; }

        public EngineSettings build() {
            if (minRosterSize < 2) {
                throw new IllegalArgumentException("Rosters need at least two players: " + minRosterSize);
            }
            if (maxRosterSize < minRosterSize || communityMaxSize < minRosterSize) {
                throw new IllegalArgumentException("Maximum roster size below minimum roster size");
            }
            if (cohesionMinFraction < 0.0 || cohesionMinFraction > 1.0) {
                throw new IllegalArgumentException("Cohesion fraction must be within [0, 1]: " + cohesionMinFraction);
            }
            if (topContributors < 0 || playerLeaderboardSize < 0 || teamResultLimit < 0) {
                throw new IllegalArgumentException("Result limits must not be negative");
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("At least one worker thread is required");
            }
            return new EngineSettings(this);
        }
    }
}
