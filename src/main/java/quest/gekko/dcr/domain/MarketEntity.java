package quest.gekko.dcr.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * Catalog row mapping the display name used by the order feed to our stable id.
 */
@Entity
@Table(name = "market_entity", uniqueConstraints = @UniqueConstraint(columnNames = { "entity_type", "name" }))
@Getter @Setter
public class MarketEntity {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false)
    EntityType entityType;

    @Column(nullable = false)
    String name;
}
