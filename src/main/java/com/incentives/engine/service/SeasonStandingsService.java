package com.incentives.engine.service;

import com.incentives.engine.exception.InvalidRequestException;
import com.incentives.engine.model.Competition;
import com.incentives.engine.model.CompetitionResult;
import com.incentives.engine.model.CompetitionStatus;
import com.incentives.engine.model.Season;
import com.incentives.engine.model.SeasonStanding;
import com.incentives.engine.repository.CompetitionRepository;
import com.incentives.engine.repository.ResultRepository;
import com.incentives.engine.repository.SeasonRepository;
import com.incentives.engine.repository.SeasonStandingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Season standings are a projection of the results of the season's completed
 * competitions and are always rebuilt from scratch.
 */
@Service
public class SeasonStandingsService {

    private static final Logger logger = LoggerFactory.getLogger(SeasonStandingsService.class);

    /** Most points, then most wins, then smallest user id. */
    static final Comparator<SeasonStanding> CHAMPION_ORDER = Comparator
        .comparingInt(SeasonStanding::getTotalPoints).reversed()
        .thenComparing(Comparator.comparingInt(SeasonStanding::getCompetitionsWon).reversed())
        .thenComparing(SeasonStanding::getUserId);

    private final CompetitionRepository competitionRepository;
    private final ResultRepository resultRepository;
    private final SeasonRepository seasonRepository;
    private final SeasonStandingRepository seasonStandingRepository;

    @Autowired
    public SeasonStandingsService(
            CompetitionRepository competitionRepository,
            ResultRepository resultRepository,
            SeasonRepository seasonRepository,
            SeasonStandingRepository seasonStandingRepository) {
        this.competitionRepository = competitionRepository;
        this.resultRepository = resultRepository;
        this.seasonRepository = seasonRepository;
        this.seasonStandingRepository = seasonStandingRepository;
    }

    public List<SeasonStanding> rebuild(String seasonId) {
        if (seasonId == null || seasonId.trim().isEmpty()) {
            throw new InvalidRequestException("SeasonId cannot be null or empty");
        }

        Instant now = Instant.now();
        Map<String, SeasonStanding> standings = new LinkedHashMap<>();

        List<Competition> competitions = competitionRepository.findBySeasonIdAndStatus(seasonId,
            CompetitionStatus.COMPLETED);
        for (Competition competition : competitions) {
            Set<String> entered = new HashSet<>();
            Set<String> won = new HashSet<>();

            for (CompetitionResult result : resultRepository.findByCompetitionId(competition.getId())) {
                SeasonStanding standing = standings.computeIfAbsent(result.getUserId(), userId ->
                    SeasonStanding.builder()
                        .seasonId(seasonId)
                        .userId(userId)
                        .build());
                standing.setUserName(result.getUserName());
                standing.setTotalPoints(standing.getTotalPoints() + result.getPointsAwarded());

                if (entered.add(result.getUserId())) {
                    standing.setCompetitionsEntered(standing.getCompetitionsEntered() + 1);
                }
                if (result.getFinalRank() == 1 && won.add(result.getUserId())) {
                    standing.setCompetitionsWon(standing.getCompetitionsWon() + 1);
                }
            }
        }

        List<SeasonStanding> rows = new ArrayList<>(standings.values());
        rows.forEach(standing -> standing.setUpdatedAt(now));
        seasonStandingRepository.saveAll(seasonId, rows);

        Optional<SeasonStanding> champion = rows.stream().min(CHAMPION_ORDER);
        if (champion.isPresent()) {
            updateChampion(seasonId, champion.get().getUserId(), now);
        }

        logger.info("Rebuilt standings of season {} from {} completed competitions: {} users, champion {}",
            seasonId, competitions.size(), rows.size(), champion.map(SeasonStanding::getUserId).orElse("none"));
        rows.sort(CHAMPION_ORDER);
        return rows;
    }

    private void updateChampion(String seasonId, String championUserId, Instant now) {
        Optional<Season> season = seasonRepository.findById(seasonId);
        if (season.isEmpty()) {
            logger.warn("Season {} not found, champion {} not stored", seasonId, championUserId);
            return;
        }
        Season updated = season.get();
        updated.setChampionUserId(championUserId);
        updated.setUpdatedAt(now);
        seasonRepository.save(updated);
    }

    public List<SeasonStanding> getStandings(String seasonId) {
        return seasonStandingRepository.findBySeasonId(seasonId);
    }
}
