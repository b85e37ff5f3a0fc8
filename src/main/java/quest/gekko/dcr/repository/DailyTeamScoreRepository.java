package quest.gekko.dcr.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.dcr.domain.DailyTeamScore;

import java.time.LocalDate;
import java.util.Optional;

public interface DailyTeamScoreRepository extends JpaRepository<DailyTeamScore, Long> {
    Optional<DailyTeamScore> findByChallengeIdAndTeamIdAndStatDate(final Long challengeId, final Long teamId, final LocalDate statDate);
}
