package quest.gekko.dcr.service.challenge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.dcr.config.RankerProperties;
import quest.gekko.dcr.domain.Challenge;
import quest.gekko.dcr.domain.ChallengeStatus;
import quest.gekko.dcr.domain.DailyTeamScore;
import quest.gekko.dcr.repository.ChallengeRepository;
import quest.gekko.dcr.repository.DailyTeamScoreRepository;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Halftime mechanics of a daily challenge: timings, the one-time score snapshot, phase status and the forward-only
 * overtime/complete transitions.
 */
@Slf4j
@Service
public class HalftimeService {
    private final ChallengeRepository challengeRepository;
    private final DailyTeamScoreRepository teamScoreRepository;
    private final ChallengeClock challengeClock;
    private final Duration overtimeLength;

    public HalftimeService(final ChallengeRepository challengeRepository,
                           final DailyTeamScoreRepository teamScoreRepository,
                           final ChallengeClock challengeClock,
                           final RankerProperties.ChallengeRules rules) {
        this.challengeRepository = challengeRepository;
        this.teamScoreRepository = teamScoreRepository;
        this.challengeClock = challengeClock;
        this.overtimeLength = Duration.ofMinutes(rules.overtimeMinutes());
    }

    @Transactional
    public Challenge initializeChallengeTimings(final Long challengeId, final Instant startTime) {
        return initializeChallengeTimings(challengeId, startTime, ChallengeClock.FULL_DAY_HOURS);
    }

    @Transactional
    public Challenge initializeChallengeTimings(final Long challengeId, final Instant startTime, final int durationHours) {
        if (durationHours <= 0) throw new IllegalArgumentException("Duration must be positive: " + durationHours);
        Challenge challenge = challengeRepository.findById(challengeId)
                .orElseThrow(() -> new IllegalArgumentException("Challenge not found: " + challengeId));
        if (challenge.isHalftimePassed() || challenge.isInOvertime() || challenge.getStatus() == ChallengeStatus.COMPLETE) {
            throw new IllegalStateException("Challenge " + challengeId + " is past halftime; timings are fixed");
        }

        Instant halftimeAt = challengeClock.halftimeAt(startTime, durationHours);
        Instant endTime = challengeClock.endTime(startTime, durationHours);
        challenge.setStartTime(startTime);
        challenge.setDurationHours(durationHours);
        challenge.setHalftimeAt(halftimeAt);
        challenge.setEndTime(endTime);
        challenge.activate();
        challenge.setUpdatedAt(challengeClock.now());

        log.info("Initialized challenge {}: start={}, halftime={}, end={}", challengeId, startTime, halftimeAt, endTime);
        return challengeRepository.save(challenge);
    }

    /**
     * Freezes both teams' current scores the first time it is called at or after halftime. Every later call, and any
     * call racing the winner, returns {@code null}.
     */
    @Transactional
    public HalftimeSnapshot takeHalftimeSnapshot(final Long challengeId) {
        Challenge challenge = challengeRepository.findById(challengeId).orElse(null);
        if (challenge == null) {
            log.error("Challenge {} not found", challengeId);
            return null;
        }
        if (challenge.isHalftimePassed()) {
            log.info("Halftime snapshot already taken for {}", challengeId);
            return null;
        }

        Instant now = challengeClock.now();
        if (challenge.getHalftimeAt() != null && now.isBefore(challenge.getHalftimeAt())) {
            log.debug("Challenge {} has not reached halftime ({})", challengeId, challenge.getHalftimeAt());
            return null;
        }
        if (challenge.getTeam1Id() == null || challenge.getTeam2Id() == null) {
            log.error("Not enough teams for challenge {}", challengeId);
            return null;
        }

        Instant dayOf = challenge.getStartTime() != null ? challenge.getStartTime() : challenge.getCreatedAt();
        LocalDate statDate = challengeClock.statDate(dayOf != null ? dayOf : now);
        int team1Score = currentScore(challengeId, challenge.getTeam1Id(), statDate);
        int team2Score = currentScore(challengeId, challenge.getTeam2Id(), statDate);

        if (challengeRepository.freezeHalftime(challengeId, team1Score, team2Score, now) == 0) {
            log.info("Halftime for {} was frozen by a concurrent caller", challengeId);
            return null;
        }

        Instant halftimeAt = challenge.getHalftimeAt() != null ? challenge.getHalftimeAt() : now;
        log.info("Halftime snapshot for challenge {}: Team1={}, Team2={}", challengeId, team1Score, team2Score);
        return new HalftimeSnapshot(challengeId, halftimeAt, challenge.getTeam1Id(), team1Score, challenge.getTeam2Id(), team2Score);
    }

    @Transactional(readOnly = true)
    public HalftimeStatus getHalftimeStatus(final Long challengeId) {
        return challengeRepository.findById(challengeId)
                .map(c -> {
                    Instant now = challengeClock.now();
                    boolean powerHour = challengeClock.isPowerHour(now, c.getDurationHours());
                    return new HalftimeStatus(c.getId(), challengeClock.phase(c, now), c.getHalftimeAt(), c.getEndTime(),
                            c.getHalftimeScoreTeam1(), c.getHalftimeScoreTeam2(), c.isHalftimePassed(), c.isInOvertime(),
                            powerHour, powerHour ? ChallengeClock.POWER_HOUR_MULTIPLIER : 1.0, c.getDurationHours());
                })
                .orElse(null);
    }

    @Transactional(readOnly = true)
    public boolean hasPassedHalftime(final Long challengeId) {
        return challengeRepository.findById(challengeId)
                .map(c -> c.getHalftimeAt() != null && !challengeClock.now().isBefore(c.getHalftimeAt()))
                .orElse(false);
    }

    /** Challenges whose halftime has arrived but whose snapshot has not been taken yet. */
    @Transactional(readOnly = true)
    public List<Long> challengesDueForSnapshot() {
        return challengeRepository
                .findByStatusAndHalftimePassedFalseAndHalftimeAtLessThanEqual(ChallengeStatus.ACTIVE, challengeClock.now())
                .stream().map(Challenge::getId).toList();
    }

    /** Starts sudden-death overtime. Returns false when the challenge is missing, complete or already in overtime. */
    @Transactional
    public boolean enterOvertime(final Long challengeId) {
        Challenge challenge = challengeRepository.findById(challengeId).orElse(null);
        if (challenge == null || challenge.isInOvertime() || challenge.getStatus() == ChallengeStatus.COMPLETE) return false;

        Instant now = challengeClock.now();
        challenge.enterOvertime(now.plus(overtimeLength));
        challenge.setUpdatedAt(now);
        challengeRepository.save(challenge);
        log.info("Started overtime for challenge {}, ends at {}", challengeId, challenge.getOvertimeEndTime());
        return true;
    }

    @Transactional
    public boolean completeChallenge(final Long challengeId) {
        Challenge challenge = challengeRepository.findById(challengeId).orElse(null);
        if (challenge == null || challenge.getStatus() == ChallengeStatus.COMPLETE) return false;

        challenge.complete();
        challenge.setUpdatedAt(challengeClock.now());
        challengeRepository.save(challenge);
        log.info("Challenge {} complete", challengeId);
        return true;
    }

    private int currentScore(Long challengeId, Long teamId, LocalDate statDate) {
        return teamScoreRepository.findByChallengeIdAndTeamIdAndStatDate(challengeId, teamId, statDate)
                .map(DailyTeamScore::getTotalPoints)
                .orElse(0);
    }
}
