package quest.gekko.dcr.service.challenge;

import quest.gekko.dcr.domain.ChallengePhase;

import java.time.Instant;

public record HalftimeStatus(Long challengeId,
                             ChallengePhase phase,
                             Instant halftimeAt,
                             Instant endTime,
                             Integer halftimeScoreTeam1,
                             Integer halftimeScoreTeam2,
                             boolean halftimePassed,
                             boolean inOvertime,
                             boolean powerHour,
                             double powerHourMultiplier,
                             int durationHours) {
}
