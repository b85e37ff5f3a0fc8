package quest.gekko.dcr.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Ledger row for a halftime lineup change. At most one row per (challenge, team, position);
 * a repeat change of the same position overwrites it and bumps {@code changeCount}.
 */
@Entity
@Table(name = "halftime_substitution",
        uniqueConstraints = @UniqueConstraint(columnNames = { "challenge_id", "team_id", "position" }))
@Getter @Setter
public class HalftimeSubstitution {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "challenge_id", nullable = false)
    Long challengeId;

    @Column(name = "team_id", nullable = false)
    Long teamId;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    LineupPosition position;

    @Enumerated(EnumType.STRING)
    EntityType oldAssetType;
    Long oldAssetId;

    @Enumerated(EnumType.STRING)
    EntityType newAssetType;
    Long newAssetId;

    int changeCount;

    @Column(nullable = false)
    Instant createdAt;
}
