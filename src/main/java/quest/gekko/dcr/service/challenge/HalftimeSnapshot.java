package quest.gekko.dcr.service.challenge;

import java.time.Instant;

public record HalftimeSnapshot(Long challengeId, Instant halftimeAt,
                               Long team1Id, int team1Score,
                               Long team2Id, int team2Score) {
}
