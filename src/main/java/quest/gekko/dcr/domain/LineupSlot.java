package quest.gekko.dcr.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "lineup_slot", uniqueConstraints = @UniqueConstraint(columnNames = { "team_id", "position" }))
@Getter @Setter
public class LineupSlot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "team_id", nullable = false)
    Long teamId;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    LineupPosition position;

    @Enumerated(EnumType.STRING)
    EntityType assetType;

    Long assetId;

    Instant updatedAt;

    public boolean isEmpty() {
        return assetId == null || assetType == null;
    }
}
