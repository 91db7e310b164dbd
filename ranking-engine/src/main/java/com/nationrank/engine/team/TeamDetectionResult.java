package com.nationrank.engine.team;

import com.nationrank.engine.model.TimeWindow;

import java.util.List;

/**
 * Teams of one type detected in one window.
 *
 * @param teams      best first, truncated to the configured result limit
 * @param totalTeams qualifying teams before truncation
 */
public record TeamDetectionResult(
        TeamType type,
        TimeWindow window,
        List<DetectedTeam> teams,
        int totalTeams
) {

    public TeamDetectionResult {
        teams = List.copyOf(teams);
    }
}
