package quest.gekko.dcr.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/** One asset on a team's drafted pool. */
@Entity
@Table(name = "roster_entry",
        uniqueConstraints = @UniqueConstraint(columnNames = { "team_id", "asset_type", "asset_id" }))
@Getter @Setter
public class RosterEntry {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "team_id", nullable = false)
    Long teamId;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_type", nullable = false)
    EntityType assetType;

    @Column(name = "asset_id", nullable = false)
    Long assetId;
}
