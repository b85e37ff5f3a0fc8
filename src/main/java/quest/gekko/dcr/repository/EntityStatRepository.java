package quest.gekko.dcr.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.dcr.domain.EntityStat;
import quest.gekko.dcr.domain.EntityType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface EntityStatRepository extends JpaRepository<EntityStat, Long> {
    Optional<EntityStat> findByEntityTypeAndEntityIdAndStatDate(final EntityType entityType, final Long entityId, final LocalDate statDate);

    // rank history window, newest first
    List<EntityStat> findByEntityTypeAndEntityIdAndStatDateBetweenOrderByStatDateDesc(final EntityType entityType, final Long entityId,
                                                                                      final LocalDate from, final LocalDate to);

    List<EntityStat> findByEntityTypeAndStatDateOrderByRankAsc(final EntityType entityType, final LocalDate statDate);
}
