package quest.gekko.dcr.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.dcr.config.RankerProperties;
import quest.gekko.dcr.domain.EntityStat;
import quest.gekko.dcr.domain.EntityType;
import quest.gekko.dcr.repository.EntityStatRepository;
import quest.gekko.dcr.service.integration.TrendSnapshot;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the historical side of an entity's score: previous rank and top-10 streak from our own stat rows,
 * market share and trailing volumes from the published trend windows.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class TrendHistoryService {
    private final EntityStatRepository statRepository;
    private final int lookbackDays;

    public TrendHistoryService(final EntityStatRepository statRepository, final RankerProperties.Aggregation props) {
        this.statRepository = statRepository;
        this.lookbackDays = props.streakLookbackDays();
    }

    public TrendInputs inputsFor(EntityType type, Long entityId, LocalDate date, int currentRank,
                                 TrendSnapshot snapshot, long categoryDays7) {
        TrendSnapshot trend = snapshot == null ? TrendSnapshot.empty(null) : snapshot;

        List<EntityStat> history = statRepository.findByEntityTypeAndEntityIdAndStatDateBetweenOrderByStatDateDesc(
                type, entityId, date.minusDays(lookbackDays), date.minusDays(1));
        Map<LocalDate, Integer> ranks = new HashMap<>();
        for (EntityStat s : history) ranks.put(s.getStatDate(), s.getRank());

        int previousRank = ranks.getOrDefault(date.minusDays(1), 0);
        int streak = TrendScoringEngine.streakDays(currentRank, date, ranks, lookbackDays);

        return new TrendInputs(
                trend.days1(), trend.days7(), trend.days14(),
                previousRank, streak,
                TrendScoringEngine.marketSharePercent(trend.days7(), categoryDays7),
                TrendScoringEngine.estimateDailyVolumes(trend));
    }
}
