package com.nationrank.engine.team;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Attendance, lineups and per-mode records derived from a team's appearances.
 */
final class TeamProfile {

    static final int COMMON_LINEUPS = 5;

    private TeamProfile() {
    }

    static Map<String, TeamStats> statsByMode(Collection<TeamAppearance> appearances) {
        Map<String, List<TeamAppearance>> byMode = appearances.stream()
                .collect(Collectors.groupingBy(TeamAppearance::gameMode, TreeMap::new, Collectors.toList()));
        Map<String, TeamStats> stats = new TreeMap<>();
        byMode.forEach((mode, list) -> stats.put(mode, TeamStats.of(list)));
        return stats;
    }

    /**
     * Members ordered by matches played desc, then id asc.
     */
    static List<TeamMember> members(Set<String> memberIds, Collection<TeamAppearance> appearances,
                                    Function<String, String> names) {
        Map<String, Integer> played = new HashMap<>();
        for (TeamAppearance appearance : appearances) {
            for (String id : appearance.lineup()) {
                if (memberIds.contains(id)) {
                    played.merge(id, 1, Integer::sum);
                }
            }
        }
        int total = appearances.size();
        List<TeamMember> members = new ArrayList<>();
        for (String id : memberIds) {
            int count = played.getOrDefault(id, 0);
            members.add(new TeamMember(id, names.apply(id), count, total > 0 ? (double) count / total : 0.0));
        }
        members.sort(Comparator.comparingInt(TeamMember::matchesPlayed).reversed()
                .thenComparing(TeamMember::playerId));
        return members;
    }

    static List<Lineup> commonLineups(Collection<TeamAppearance> appearances, Function<String, String> names) {
        Map<String, List<TeamAppearance>> byLineup = appearances.stream()
                .collect(Collectors.groupingBy(TeamAppearance::lineupKey, TreeMap::new, Collectors.toList()));
        return byLineup.values().stream()
                .sorted(Comparator.comparingInt((List<TeamAppearance> l) -> l.size()).reversed()
                        .thenComparing(l -> l.get(0).lineupKey()))
                .limit(COMMON_LINEUPS)
                .map(l -> {
                    List<String> ids = l.get(0).lineup();
                    List<String> lineupNames = ids.stream().map(names).collect(Collectors.toList());
                    return new Lineup(ids, lineupNames, l.size());
                })
                .collect(Collectors.toList());
    }

    static String squadName(List<TeamMember> members) {
        return members.isEmpty() ? "Unnamed Squad" : members.get(0).playerName() + "'s Squad";
    }
}
