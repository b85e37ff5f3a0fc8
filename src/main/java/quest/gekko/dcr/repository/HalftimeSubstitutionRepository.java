package quest.gekko.dcr.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.dcr.domain.HalftimeSubstitution;
import quest.gekko.dcr.domain.LineupPosition;

import java.util.Optional;

public interface HalftimeSubstitutionRepository extends JpaRepository<HalftimeSubstitution, Long> {
    long countByChallengeIdAndTeamId(final Long challengeId, final Long teamId);

    Optional<HalftimeSubstitution> findByChallengeIdAndTeamIdAndPosition(final Long challengeId, final Long teamId, final LineupPosition position);

    @Query("select coalesce(sum(s.changeCount), 0) from HalftimeSubstitution s where s.challengeId = :challengeId and s.teamId = :teamId")
    long sumChangeCount(@Param("challengeId") final Long challengeId, @Param("teamId") final Long teamId);
}
