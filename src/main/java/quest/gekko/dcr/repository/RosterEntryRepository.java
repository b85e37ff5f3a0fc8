package quest.gekko.dcr.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.dcr.domain.EntityType;
import quest.gekko.dcr.domain.RosterEntry;

public interface RosterEntryRepository extends JpaRepository<RosterEntry, Long> {
    boolean existsByTeamIdAndAssetTypeAndAssetId(final Long teamId, final EntityType assetType, final Long assetId);
}
