package com.nationrank.engine.model;

/**
 * One roster row of a match.
 *
 * @param playerId         stable player id
 * @param playerName       display name, falls back to {@code Player_<id>} when unknown
 * @param countryCode      nation code as reported by the player profile (nullable)
 * @param partyId          party the player queued with (nullable)
 * @param teamSide         side the player fought on
 * @param outcome          result for this player
 * @param skill            rating after the match, when the source carries it (nullable)
 * @param skillUncertainty rating uncertainty after the match (nullable)
 */
public record PlayerResult(
        String playerId,
        String playerName,
        String countryCode,
        String partyId,
        int teamSide,
        Outcome outcome,
        Double skill,
        Double skillUncertainty
) {

    public PlayerResult {
        if (playerName == null || playerName.isBlank()) {
            playerName = playerId != null ? "Player_" + playerId : null;
        }
    }

    public PlayerResult(String playerId, String playerName, String countryCode,
                        String partyId, int teamSide, Outcome outcome) {
        this(playerId, playerName, countryCode, partyId, teamSide, outcome, null, null);
    }

    public boolean isWin() {
        return outcome == Outcome.WIN;
    }

    public boolean isLoss() {
        return outcome == Outcome.LOSS;
    }

    public boolean hasParty() {
        return partyId != null && !partyId.isBlank();
    }

    public boolean hasSkill() {
        return skill != null && skillUncertainty != null;
    }
}
