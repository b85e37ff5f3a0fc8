package quest.gekko.dcr.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.dcr.domain.LineupPosition;
import quest.gekko.dcr.domain.LineupSlot;

import java.util.Optional;

public interface LineupSlotRepository extends JpaRepository<LineupSlot, Long> {
    Optional<LineupSlot> findByTeamIdAndPosition(final Long teamId, final LineupPosition position);
}
