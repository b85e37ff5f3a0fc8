package quest.gekko.dcr.service.challenge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import quest.gekko.dcr.domain.Challenge;
import quest.gekko.dcr.domain.ChallengePhase;
import quest.gekko.dcr.domain.ChallengeStatus;
import quest.gekko.dcr.domain.DailyTeamScore;
import quest.gekko.dcr.repository.ChallengeRepository;
import quest.gekko.dcr.repository.DailyTeamScoreRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static quest.gekko.dcr.service.challenge.ChallengeClockTest.DAY;
import static quest.gekko.dcr.service.challenge.ChallengeClockTest.RULES;
import static quest.gekko.dcr.service.challenge.ChallengeClockTest.at;

class HalftimeServiceTest {
    private ChallengeRepository challengeRepo;
    private DailyTeamScoreRepository scoreRepo;
    private Challenge challenge;

    @BeforeEach
    void setUp() {
        challengeRepo = mock(ChallengeRepository.class);
        scoreRepo = mock(DailyTeamScoreRepository.class);

        challenge = new Challenge();
        challenge.setId(1L);
        challenge.setTeam1Id(10L);
        challenge.setTeam2Id(20L);
        challenge.setStartTime(at(9, 0));
        challenge.setHalftimeAt(at(16, 20));
        challenge.setEndTime(at(9, 0).plus(Duration.ofHours(24)));
        challenge.activate();

        when(challengeRepo.findById(1L)).thenReturn(Optional.of(challenge));
        when(challengeRepo.save(any(Challenge.class))).thenAnswer(i -> i.getArgument(0));
        when(scoreRepo.findByChallengeIdAndTeamIdAndStatDate(1L, 10L, DAY)).thenReturn(Optional.of(score(120)));
        when(scoreRepo.findByChallengeIdAndTeamIdAndStatDate(1L, 20L, DAY)).thenReturn(Optional.of(score(95)));
        when(challengeRepo.freezeHalftime(eq(1L), anyInt(), anyInt(), any())).thenAnswer(i -> {
            if (challenge.isHalftimePassed()) return 0;
            ReflectionTestUtils.setField(challenge, "halftimePassed", true);
            return 1;
        });
    }

    private static DailyTeamScore score(int points) {
        DailyTeamScore s = new DailyTeamScore();
        s.setTotalPoints(points);
        return s;
    }

    private HalftimeService serviceAt(Instant now) {
        return new HalftimeService(challengeRepo, scoreRepo, new ChallengeClock(Clock.fixed(now, ZoneOffset.UTC), RULES), RULES);
    }

    @Test
    void snapshotIsTakenExactlyOnce() {
        HalftimeService service = serviceAt(at(16, 21));

        HalftimeSnapshot first = service.takeHalftimeSnapshot(1L);
        HalftimeSnapshot second = service.takeHalftimeSnapshot(1L);

        assertThat(first).isNotNull();
        assertThat(first.team1Score()).isEqualTo(120);
        assertThat(first.team2Score()).isEqualTo(95);
        assertThat(first.halftimeAt()).isEqualTo(at(16, 20));
        assertThat(second).isNull();
    }

    @Test
    void challengeWithoutStartOrCreationTimeScoresTheCurrentDay() {
        challenge.setStartTime(null);
        challenge.setCreatedAt(null);

        HalftimeSnapshot snapshot = serviceAt(at(16, 45)).takeHalftimeSnapshot(1L);

        assertThat(snapshot.team1Score()).isEqualTo(120);
        verify(scoreRepo).findByChallengeIdAndTeamIdAndStatDate(1L, 10L, DAY);
    }

    @Test
    void losingTheRaceReturnsNull() {
        doReturn(0).when(challengeRepo).freezeHalftime(eq(1L), anyInt(), anyInt(), any());

        assertThat(serviceAt(at(16, 30)).takeHalftimeSnapshot(1L)).isNull();
    }

    @Test
    void noSnapshotBeforeHalftime() {
        assertThat(serviceAt(at(16, 19)).takeHalftimeSnapshot(1L)).isNull();
        verify(challengeRepo, never()).freezeHalftime(anyLong(), anyInt(), anyInt(), any());
    }

    @Test
    void missingTeamsScoreAsZero() {
        when(scoreRepo.findByChallengeIdAndTeamIdAndStatDate(1L, 20L, DAY)).thenReturn(Optional.empty());

        HalftimeSnapshot snapshot = serviceAt(at(17, 0)).takeHalftimeSnapshot(1L);

        assertThat(snapshot.team2Score()).isZero();
    }

    @Test
    void snapshotNeedsTwoTeamsAndAChallenge() {
        challenge.setTeam2Id(null);
        HalftimeService service = serviceAt(at(17, 0));

        assertThat(service.takeHalftimeSnapshot(1L)).isNull();
        assertThat(service.takeHalftimeSnapshot(99L)).isNull();
    }

    @Test
    void initializingTimingsActivatesTheChallenge() {
        Challenge fresh = new Challenge();
        fresh.setId(2L);
        when(challengeRepo.findById(2L)).thenReturn(Optional.of(fresh));

        Challenge saved = serviceAt(at(8, 0)).initializeChallengeTimings(2L, at(9, 0));

        assertThat(saved.getHalftimeAt()).isEqualTo(at(16, 20));
        assertThat(saved.getEndTime()).isEqualTo(at(9, 0).plus(Duration.ofHours(24)));
        assertThat(saved.getDurationHours()).isEqualTo(24);
        assertThat(saved.getStatus()).isEqualTo(ChallengeStatus.ACTIVE);
    }

    @Test
    void timingsAreFixedOnceHalftimePassed() {
        HalftimeService service = serviceAt(at(16, 30));
        service.takeHalftimeSnapshot(1L);

        assertThatThrownBy(() -> service.initializeChallengeTimings(1L, at(10, 0)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> service.initializeChallengeTimings(99L, at(10, 0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.initializeChallengeTimings(1L, at(10, 0), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statusReportsPhaseAndPowerHour() {
        HalftimeStatus status = serviceAt(at(16, 0)).getHalftimeStatus(1L);

        assertThat(status.phase()).isEqualTo(ChallengePhase.FIRST_HALF);
        assertThat(status.powerHour()).isTrue();
        assertThat(status.powerHourMultiplier()).isEqualTo(2.0);
        assertThat(status.halftimePassed()).isFalse();
        assertThat(serviceAt(at(16, 0)).getHalftimeStatus(99L)).isNull();
    }

    @Test
    void hasPassedHalftimeFollowsTheClock() {
        assertThat(serviceAt(at(16, 19)).hasPassedHalftime(1L)).isFalse();
        assertThat(serviceAt(at(16, 20)).hasPassedHalftime(1L)).isTrue();
        assertThat(serviceAt(at(16, 20)).hasPassedHalftime(99L)).isFalse();
    }

    @Test
    void dueChallengesComeFromTheRepository() {
        Challenge other = new Challenge();
        other.setId(5L);
        when(challengeRepo.findByStatusAndHalftimePassedFalseAndHalftimeAtLessThanEqual(ChallengeStatus.ACTIVE, at(16, 25)))
                .thenReturn(List.of(challenge, other));

        assertThat(serviceAt(at(16, 25)).challengesDueForSnapshot()).containsExactly(1L, 5L);
    }

    @Test
    void overtimeAndCompletionOnlyMoveForward() {
        HalftimeService service = serviceAt(at(9, 5).plus(Duration.ofHours(24)));

        assertThat(service.enterOvertime(1L)).isTrue();
        assertThat(challenge.getOvertimeEndTime()).isEqualTo(at(10, 5).plus(Duration.ofHours(24)));
        assertThat(service.enterOvertime(1L)).isFalse();

        assertThat(service.completeChallenge(1L)).isTrue();
        assertThat(service.completeChallenge(1L)).isFalse();
        assertThat(challenge.getStatus()).isEqualTo(ChallengeStatus.COMPLETE);
    }

    @Test
    void completedChallengeCannotEnterOvertime() {
        HalftimeService service = serviceAt(at(20, 0));
        service.completeChallenge(1L);

        assertThat(service.enterOvertime(1L)).isFalse();
        assertThat(challenge.isInOvertime()).isFalse();
        assertThatThrownBy(() -> challenge.enterOvertime(at(21, 0))).isInstanceOf(IllegalStateException.class);
    }
}
