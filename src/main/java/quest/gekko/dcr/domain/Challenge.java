package quest.gekko.dcr.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * A head-to-head daily challenge between two teams. The phase flags ({@code halftimePassed},
 * {@code inOvertime}, {@link ChallengeStatus#COMPLETE}) only ever move forward, so they have no
 * plain setters. {@code halftimePassed} is flipped by a conditional update in
 * {@code ChallengeRepository#freezeHalftime}.
 */
@Entity
@Table(name = "challenge")
@Getter @Setter
public class Challenge {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "team1_id")
    Long team1Id;

    @Column(name = "team2_id")
    Long team2Id;

    Instant startTime;
    int durationHours = 24;
    Instant halftimeAt;
    Instant endTime;

    @Column(name = "halftime_score_team1")
    Integer halftimeScoreTeam1;

    @Column(name = "halftime_score_team2")
    Integer halftimeScoreTeam2;

    @Setter(AccessLevel.NONE)
    @Column(name = "halftime_passed", nullable = false)
    boolean halftimePassed;

    @Setter(AccessLevel.NONE)
    @Column(name = "in_overtime", nullable = false)
    boolean inOvertime;

    Instant overtimeEndTime;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING) @Column(nullable = false)
    ChallengeStatus status = ChallengeStatus.OPEN;

    @Column(nullable = false)
    Instant createdAt;

    Instant updatedAt;

    public void activate() {
        if (status == ChallengeStatus.OPEN) status = ChallengeStatus.ACTIVE;
    }

    public void enterOvertime(Instant until) {
        if (status == ChallengeStatus.COMPLETE) throw new IllegalStateException("Challenge " + id + " is complete");
        inOvertime = true;
        overtimeEndTime = until;
    }

    public void complete() {
        status = ChallengeStatus.COMPLETE;
    }
}
