package quest.gekko.dcr.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.dcr.domain.Challenge;
import quest.gekko.dcr.domain.ChallengeStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ChallengeRepository extends JpaRepository<Challenge, Long> {

    /**
     * Row-locks the challenge until the surrounding transaction ends. Substitutions for one challenge are applied
     * one at a time through this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Challenge c where c.id = :id")
    Optional<Challenge> findLockedById(@Param("id") final Long id);

    List<Challenge> findByStatusAndHalftimePassedFalseAndHalftimeAtLessThanEqual(final ChallengeStatus status, final Instant now);

    /**
     * Compare-and-set of the halftime flag. Returns 1 for the caller that froze the scores, 0 for everyone else.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update Challenge c
           set c.halftimeScoreTeam1 = :team1Score,
               c.halftimeScoreTeam2 = :team2Score,
               c.halftimePassed = true,
               c.updatedAt = :now
         where c.id = :id and c.halftimePassed = false
        """)
    int freezeHalftime(@Param("id") final Long id,
                       @Param("team1Score") final int team1Score,
                       @Param("team2Score") final int team2Score,
                       @Param("now") final Instant now);
}
