package quest.gekko.dcr.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.dcr.domain.EntityStat;
import quest.gekko.dcr.domain.EntityType;
import quest.gekko.dcr.repository.EntityStatRepository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
@RequiredArgsConstructor
public class StatsService {
    private final EntityStatRepository statRepo;
    private final Clock clock;

    /**
     * Writes the day's row for an entity, overwriting every counter and score of an earlier run for the same date.
     */
    @Transactional
    public EntityStat upsert(final EntityType type, final Long entityId, final LocalDate date,
                             final RankedEntity ranked, final ScoreBreakdown score) {
        EntityStat stat = statRepo.findByEntityTypeAndEntityIdAndStatDate(type, entityId, date)
                .orElseGet(() -> {
                    EntityStat fresh = new EntityStat();
                    fresh.setEntityType(type);
                    fresh.setEntityId(entityId);
                    fresh.setStatDate(date);
                    return fresh;
                });

        EntityCounters c = ranked.counters();
        stat.setVolume(c.volume());
        stat.setOrderCount(c.orderCount());
        stat.setRevenueCents(c.revenueCents());
        stat.setTotalRatings(c.totalRatings());
        stat.setBayesianAverage(type == EntityType.BRAND ? decimal(c.bayesianAverage(), 3) : null);
        stat.setRank(ranked.rank());
        stat.setPreviousRank(score.previousRank());
        stat.setTrendMultiplier(decimal(score.trendMultiplier(), 2));
        stat.setConsistencyScore(score.consistencyScore());
        stat.setVelocityScore(score.velocityScore());
        stat.setStreakDays(score.streakDays());
        stat.setMarketSharePercent(decimal(score.marketSharePercent(), 2));
        stat.setTotalPoints(score.totalPoints());
        stat.setUpdatedAt(clock.instant());
        return statRepo.save(stat);
    }

    @Transactional(readOnly = true)
    public List<EntityStat> rankingFor(final EntityType type, final LocalDate date) {
        return statRepo.findByEntityTypeAndStatDateOrderByRankAsc(type, date);
    }

    private static BigDecimal decimal(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }
}
