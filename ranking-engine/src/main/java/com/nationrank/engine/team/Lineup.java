package com.nationrank.engine.team;

import java.util.List;

/**
 * A concrete set of players fielded together, ids sorted ascending.
 */
public record Lineup(List<String> playerIds, List<String> playerNames, int matches) {
}
