package quest.gekko.dcr.web.dto;

import quest.gekko.dcr.domain.EntityStat;
import quest.gekko.dcr.domain.EntityType;

import java.math.BigDecimal;
import java.time.LocalDate;

public record RankingEntryDTO(
        EntityType entityType,
        Long entityId,
        String name,
        LocalDate statDate,

        int rank,
        int previousRank,
        int totalPoints,

        long volume,
        int orderCount,
        long revenueCents,
        int totalRatings,

        BigDecimal trendMultiplier,
        int consistencyScore,
        int velocityScore,
        int streakDays,
        BigDecimal marketSharePercent
) {
    public static RankingEntryDTO of(EntityStat s, String name) {
        return new RankingEntryDTO(s.getEntityType(), s.getEntityId(), name, s.getStatDate(),
                s.getRank(), s.getPreviousRank(), s.getTotalPoints(),
                s.getVolume(), s.getOrderCount(), s.getRevenueCents(), s.getTotalRatings(),
                s.getTrendMultiplier(), s.getConsistencyScore(), s.getVelocityScore(), s.getStreakDays(),
                s.getMarketSharePercent());
    }
}
