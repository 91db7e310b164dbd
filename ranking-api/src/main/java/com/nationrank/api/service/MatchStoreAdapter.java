package com.nationrank.api.service;

import com.nationrank.api.config.RankingProperties;
import com.nationrank.api.model.readonly.MatchDocument;
import com.nationrank.api.model.readonly.MatchPlayerEntry;
import com.nationrank.api.model.readonly.PlayerDocument;
import com.nationrank.api.repository.readonly.MatchReadRepository;
import com.nationrank.api.repository.readonly.PlayerReadRepository;
import com.nationrank.engine.model.MatchRecord;
import com.nationrank.engine.model.MatchSnapshot;
import com.nationrank.engine.model.Outcome;
import com.nationrank.engine.model.PlayerResult;
import com.nationrank.engine.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the match store once per request or run and turns it into an immutable
 * {@link MatchSnapshot}. Player names and countries are joined in from the players
 * collection.
 */
@Service
public class MatchStoreAdapter {

    private static final Logger log = LoggerFactory.getLogger(MatchStoreAdapter.class);

    static final String NO_WINNER = "no winner recorded";
    static final String PLAYER_WITHOUT_TEAM = "player without team";

    private final MatchReadRepository matchRepository;
    private final PlayerReadRepository playerRepository;
    private final RankingProperties properties;

    public MatchStoreAdapter(
            MatchReadRepository matchRepository,
            PlayerReadRepository playerRepository,
            RankingProperties properties
    ) {
        this.matchRepository = matchRepository;
        this.playerRepository = playerRepository;
        this.properties = properties;
    }

    public MatchSnapshot loadSnapshot(TimeWindow window) {
        List<MatchDocument> documents = matchRepository.findByStartTimeWindow(window.start(), window.end());
        Map<String, PlayerDocument> profiles = loadProfiles(documents);

        MatchSnapshot.Builder builder = MatchSnapshot.builder(window);
        int unranked = 0;
        for (MatchDocument document : documents) {
            if (document == null) {
                builder.reject("null record");
                continue;
            }
            if (properties.isRankedOnly() && !document.isRanked()) {
                unranked++;
                continue;
            }
            String problem = problemWith(document);
            if (problem != null) {
                builder.reject(problem);
                log.debug("Rejected match {}: {}", document.getMatchId(), problem);
                continue;
            }
            builder.add(toRecord(document, profiles));
        }

        if (unranked > 0) {
            log.info("Ignored {} unranked matches in {}", unranked, window);
        }
        return builder.build();
    }

    private Map<String, PlayerDocument> loadProfiles(List<MatchDocument> documents) {
        Set<String> userIds = documents.stream()
                .filter(Objects::nonNull)
                .flatMap(d -> d.getPlayers() == null ? Stream.empty() : d.getPlayers().stream())
                .filter(Objects::nonNull)
                .map(MatchPlayerEntry::getUserId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        if (userIds.isEmpty()) {
            return Map.of();
        }
        Map<String, PlayerDocument> profiles = new HashMap<>();
        for (PlayerDocument profile : playerRepository.findByUserIdIn(userIds)) {
            profiles.put(profile.getUserId(), profile);
        }
        log.debug("Loaded {} player profiles for {} players", profiles.size(), userIds.size());
        return profiles;
    }

    /**
     * Problems the engine cannot see once the record is mapped; everything else is
     * validated by the snapshot builder.
     */
    private static String problemWith(MatchDocument document) {
        if (!document.isDraw() && document.getWinningTeam() == null) {
            return NO_WINNER;
        }
        if (document.getPlayers() != null) {
            for (MatchPlayerEntry entry : document.getPlayers()) {
                if (entry != null && entry.getTeamId() == null) {
                    return PLAYER_WITHOUT_TEAM;
                }
            }
        }
        return null;
    }

    static MatchRecord toRecord(MatchDocument document, Map<String, PlayerDocument> profiles) {
        List<PlayerResult> players = new ArrayList<>();
        if (document.getPlayers() != null) {
            for (MatchPlayerEntry entry : document.getPlayers()) {
                players.add(entry == null ? null : toResult(document, entry, profiles.get(entry.getUserId())));
            }
        }
        return new MatchRecord(document.getMatchId(), document.getGameType(), document.getStartTime(), players);
    }

    private static PlayerResult toResult(MatchDocument document, MatchPlayerEntry entry, PlayerDocument profile) {
        Outcome outcome;
        if (document.isDraw()) {
            outcome = Outcome.DRAW;
        } else {
            outcome = entry.getTeamId().equals(document.getWinningTeam()) ? Outcome.WIN : Outcome.LOSS;
        }
        return new PlayerResult(
                entry.getUserId(),
                profile != null ? profile.getName() : null,
                profile != null ? profile.getCountryCode() : null,
                entry.getPartyId(),
                entry.getTeamId(),
                outcome,
                entry.getSkill(),
                entry.getUncertainty()
        );
    }
}
