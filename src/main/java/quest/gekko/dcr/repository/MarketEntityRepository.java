package quest.gekko.dcr.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.dcr.domain.EntityType;
import quest.gekko.dcr.domain.MarketEntity;

import java.util.Optional;

public interface MarketEntityRepository extends JpaRepository<MarketEntity, Long> {
    Optional<MarketEntity> findByEntityTypeAndName(final EntityType entityType, final String name);
}
