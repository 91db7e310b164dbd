package com.nationrank.engine.team;

import com.nationrank.engine.EngineSettings;
import com.nationrank.engine.graph.CoOccurrenceGraph;
import com.nationrank.engine.model.MatchRecord;
import com.nationrank.engine.model.PlayerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Finds recurring party rosters.
 *
 * <p>A party instance is the group of players sharing one party id in one match. Every
 * distinct roster among the instances is a candidate. Its stability is the number of
 * instances with exactly that roster divided by the number of instances that contain
 * any of its members.
 */
public class PartyTeamDetector {

    private static final Logger log = LoggerFactory.getLogger(PartyTeamDetector.class);

    static final Comparator<PartyTeam> ORDER = Comparator
            .comparingInt(PartyTeam::matches).reversed()
            .thenComparing(Comparator.comparingDouble(PartyTeam::stabilityScore).reversed())
            .thenComparing(PartyTeam::teamId);

    private final EngineSettings settings;

    public PartyTeamDetector(EngineSettings settings) {
        this.settings = settings;
    }

    /**
     * All qualifying party teams, best first.
     */
    public List<PartyTeam> detect(Collection<MatchRecord> matches, CoOccurrenceGraph graph) {
        List<TeamAppearance> instances = partyInstances(matches);

        Map<String, Set<Integer>> instancesByPlayer = new HashMap<>();
        Map<String, List<TeamAppearance>> byRoster = new TreeMap<>();
        for (int i = 0; i < instances.size(); i++) {
            TeamAppearance instance = instances.get(i);
            byRoster.computeIfAbsent(instance.lineupKey(), k -> new ArrayList<>()).add(instance);
            for (String id : instance.lineup()) {
                instancesByPlayer.computeIfAbsent(id, k -> new TreeSet<>()).add(i);
            }
        }

        List<PartyTeam> teams = new ArrayList<>();
        int belowMinimum = 0;
        for (List<TeamAppearance> exact : byRoster.values()) {
            if (exact.size() < settings.getMinTeamMatches()) {
                belowMinimum++;
                continue;
            }
            List<String> roster = exact.get(0).lineup();
            Set<Integer> related = new TreeSet<>();
            roster.forEach(id -> related.addAll(instancesByPlayer.getOrDefault(id, Set.of())));
            teams.add(toTeam(roster, exact, related.stream().map(instances::get).collect(Collectors.toList()), graph));
        }

        teams.sort(ORDER);
        log.info("Party detection: {} party instances, {} distinct rosters, {} teams ({} below {} matches)",
                instances.size(), byRoster.size(), teams.size(), belowMinimum, settings.getMinTeamMatches());
        return teams;
    }

    private PartyTeam toTeam(List<String> roster, List<TeamAppearance> exact,
                             List<TeamAppearance> related, CoOccurrenceGraph graph) {
        Set<String> memberIds = new LinkedHashSet<>(roster);
        List<TeamAppearance> groupGames = bestPerMatch(related, memberIds);
        List<TeamMember> members = TeamProfile.members(memberIds, groupGames, graph::nameOf);

        return new PartyTeam(
                String.join("+", roster),
                TeamProfile.squadName(members),
                roster,
                exact.size(),
                related.isEmpty() ? 0.0 : (double) exact.size() / related.size(),
                TeamStats.of(exact),
                TeamProfile.statsByMode(exact),
                members,
                TeamProfile.commonLineups(groupGames, graph::nameOf)
        );
    }

    /**
     * Party instances holding at least two members, one per match: the one with the most members.
     */
    static List<TeamAppearance> bestPerMatch(List<TeamAppearance> instances, Set<String> memberIds) {
        Map<String, TeamAppearance> best = new LinkedHashMap<>();
        Map<String, Integer> bestOverlap = new HashMap<>();
        for (TeamAppearance instance : instances) {
            int overlap = (int) instance.lineup().stream().filter(memberIds::contains).count();
            if (overlap < 2) {
                continue;
            }
            Integer current = bestOverlap.get(instance.matchId());
            if (current == null || overlap > current) {
                best.put(instance.matchId(), instance);
                bestOverlap.put(instance.matchId(), overlap);
            }
        }
        return new ArrayList<>(best.values());
    }

    List<TeamAppearance> partyInstances(Collection<MatchRecord> matches) {
        List<TeamAppearance> instances = new ArrayList<>();
        int outsideSize = 0;
        for (MatchRecord match : matches) {
            Map<String, Map<String, PlayerResult>> parties = new TreeMap<>();
            for (PlayerResult result : match.players()) {
                if (result.hasParty()) {
                    parties.computeIfAbsent(result.partyId(), k -> new TreeMap<>())
                            .putIfAbsent(result.playerId(), result);
                }
            }
            for (Map<String, PlayerResult> party : parties.values()) {
                if (party.size() < settings.getMinRosterSize() || party.size() > settings.getMaxRosterSize()) {
                    outsideSize++;
                    continue;
                }
                List<String> roster = new ArrayList<>(party.keySet());
                PlayerResult first = party.values().iterator().next();
                instances.add(new TeamAppearance(match.matchId(), match.gameMode(), roster, first.outcome()));
            }
        }
        if (outsideSize > 0) {
            log.debug("Ignored {} party instances outside roster size {}..{}", outsideSize,
                    settings.getMinRosterSize(), settings.getMaxRosterSize());
        }
        return instances;
    }
}
