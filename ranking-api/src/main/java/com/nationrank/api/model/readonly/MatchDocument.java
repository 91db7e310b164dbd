package com.nationrank.api.model.readonly;

import org.springframework.data.annotation.Id;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only model of a finished match in the match store.
 * This service never writes to this collection.
 */
@org.springframework.data.mongodb.core.mapping.Document(collection = "matches")
public class MatchDocument {

    @Id
    private String id;

    private String matchId;
    private String gameType;
    private Instant startTime;
    private Boolean ranked;
    private Integer winningTeam;
    private Boolean draw;
    private List<MatchPlayerEntry> players = new ArrayList<>();

    public MatchDocument() {
    }

    public MatchDocument(String matchId, String gameType, Instant startTime, Boolean ranked,
                         Integer winningTeam, Boolean draw, List<MatchPlayerEntry> players) {
        this.matchId = matchId;
        this.gameType = gameType;
        this.startTime = startTime;
        this.ranked = ranked;
        this.winningTeam = winningTeam;
        this.draw = draw;
        this.players = players;
    }

    // Getters only (read-only)
    public String getId() { return id; }
    public String getMatchId() { return matchId; }
    public String getGameType() { return gameType; }
    public Instant getStartTime() { return startTime; }
    public Boolean getRanked() { return ranked; }
    public Integer getWinningTeam() { return winningTeam; }
    public Boolean getDraw() { return draw; }
    public List<MatchPlayerEntry> getPlayers() { return players; }

    /**
     * Matches without the flag are treated as ranked.
     */
    public boolean isRanked() {
        return ranked == null || ranked;
    }

    public boolean isDraw() {
        return Boolean.TRUE.equals(draw);
    }
}
