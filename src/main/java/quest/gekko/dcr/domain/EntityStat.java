package quest.gekko.dcr.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "entity_stat",
        uniqueConstraints = @UniqueConstraint(columnNames = { "entity_type", "entity_id", "stat_date" }))
@Getter @Setter
public class EntityStat {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false)
    EntityType entityType;

    @Column(name = "entity_id", nullable = false)
    Long entityId;

    @Column(name = "stat_date", nullable = false)
    LocalDate statDate;

    long volume;
    int orderCount;
    long revenueCents;

    // brands only
    int totalRatings;
    @Column(precision = 6, scale = 3)
    BigDecimal bayesianAverage;

    @Column(name = "stat_rank")
    int rank;
    int previousRank;

    @Column(precision = 6, scale = 2)
    BigDecimal trendMultiplier;
    int consistencyScore;
    int velocityScore;
    int streakDays;
    @Column(precision = 6, scale = 2)
    BigDecimal marketSharePercent;

    int totalPoints;

    @Column(nullable = false)
    Instant updatedAt;
}
