package quest.gekko.dcr.repository;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import quest.gekko.dcr.domain.Challenge;
import quest.gekko.dcr.domain.ChallengeStatus;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class ChallengeRepositoryTest {
    private static final Instant HALFTIME = Instant.parse("2024-11-07T15:20:00Z");

    @Autowired
    private ChallengeRepository challengeRepository;

    private Challenge activeChallenge() {
        Challenge c = new Challenge();
        c.setTeam1Id(10L);
        c.setTeam2Id(20L);
        c.setStartTime(Instant.parse("2024-11-07T08:00:00Z"));
        c.setHalftimeAt(HALFTIME);
        c.setCreatedAt(Instant.parse("2024-11-07T07:55:00Z"));
        c.activate();
        return challengeRepository.saveAndFlush(c);
    }

    @Test
    void freezeHalftimeSucceedsOnlyOnce() {
        Long id = activeChallenge().getId();

        int first = challengeRepository.freezeHalftime(id, 120, 95, HALFTIME.plusSeconds(30));
        int second = challengeRepository.freezeHalftime(id, 999, 999, HALFTIME.plusSeconds(60));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        Challenge reloaded = challengeRepository.findById(id).orElseThrow();
        assertThat(reloaded.isHalftimePassed()).isTrue();
        assertThat(reloaded.getHalftimeScoreTeam1()).isEqualTo(120);
        assertThat(reloaded.getHalftimeScoreTeam2()).isEqualTo(95);
    }

    @Test
    void dueChallengesExcludeFrozenAndFutureOnes() {
        Long due = activeChallenge().getId();
        Long frozen = activeChallenge().getId();
        challengeRepository.freezeHalftime(frozen, 1, 2, HALFTIME);
        Challenge later = activeChallenge();
        later.setHalftimeAt(HALFTIME.plusSeconds(3600));
        challengeRepository.saveAndFlush(later);

        assertThat(challengeRepository.findByStatusAndHalftimePassedFalseAndHalftimeAtLessThanEqual(ChallengeStatus.ACTIVE, HALFTIME))
                .extracting(Challenge::getId)
                .containsExactly(due);
    }
}
