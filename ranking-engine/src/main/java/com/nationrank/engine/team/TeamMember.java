package com.nationrank.engine.team;

/**
 * @param matchesPlayed team matches this member played in
 * @param attendance    {@code matchesPlayed} over all team matches, within [0, 1]
 */
public record TeamMember(String playerId, String playerName, int matchesPlayed, double attendance) {
}
