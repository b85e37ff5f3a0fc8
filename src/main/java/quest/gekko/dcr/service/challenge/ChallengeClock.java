package quest.gekko.dcr.service.challenge;

import org.springframework.stereotype.Component;
import quest.gekko.dcr.config.RankerProperties;
import quest.gekko.dcr.domain.Challenge;
import quest.gekko.dcr.domain.ChallengePhase;
import quest.gekko.dcr.domain.ChallengeStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Wall-clock rules of a daily challenge: when halftime falls, when the game ends, which phase it is in and whether
 * Power Hour is on. Nothing here touches persistence.
 */
@Component
public class ChallengeClock {
    public static final int FULL_DAY_HOURS = 24;
    public static final LocalTime HALFTIME = LocalTime.of(16, 20);
    public static final LocalTime POWER_HOUR_START = LocalTime.of(15, 30);
    public static final LocalTime POWER_HOUR_END = LocalTime.of(17, 30);
    public static final double POWER_HOUR_MULTIPLIER = 2.0;

    private final Clock clock;
    private final ZoneId zone;
    private final Duration halftimeWindow;

    public ChallengeClock(final Clock clock, final RankerProperties.ChallengeRules rules) {
        this.clock = clock;
        this.zone = ZoneId.of(rules.zone());
        this.halftimeWindow = Duration.ofMinutes(rules.halftimeWindowMinutes());
    }

    public Instant now() {
        return clock.instant();
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Full-day games break at 16:20 local on the start day, or the next day when they start at or after 16:20.
     * Any other duration breaks at the exact midpoint.
     */
    public Instant halftimeAt(Instant start, int durationHours) {
        if (durationHours == FULL_DAY_HOURS) {
            ZonedDateTime localStart = start.atZone(zone);
            ZonedDateTime halftime = localStart.with(HALFTIME);
            if (!localStart.toLocalTime().isBefore(HALFTIME)) {
                halftime = halftime.plusDays(1);
            }
            return halftime.toInstant();
        }
        return start.plus(Duration.ofHours(durationHours).dividedBy(2));
    }

    public Instant endTime(Instant start, int durationHours) {
        return start.plus(Duration.ofHours(durationHours));
    }

    public LocalDate statDate(Instant start) {
        return start.atZone(zone).toLocalDate();
    }

    public boolean isPowerHour(int durationHours) {
        return isPowerHour(now(), durationHours);
    }

    /** 15:30 through 17:30 local, minute resolution, both ends included. Full-day games only. */
    public boolean isPowerHour(Instant at, int durationHours) {
        if (durationHours != FULL_DAY_HOURS) return false;
        LocalTime local = at.atZone(zone).toLocalTime().withSecond(0).withNano(0);
        return !local.isBefore(POWER_HOUR_START) && !local.isAfter(POWER_HOUR_END);
    }

    public double powerHourMultiplier(int durationHours) {
        return powerHourMultiplier(now(), durationHours);
    }

    public double powerHourMultiplier(Instant at, int durationHours) {
        return isPowerHour(at, durationHours) ? POWER_HOUR_MULTIPLIER : 1.0;
    }

    public ChallengePhase phase(Challenge challenge) {
        return phase(challenge, now());
    }

    public ChallengePhase phase(Challenge challenge, Instant at) {
        if (challenge.getStatus() == ChallengeStatus.COMPLETE) return ChallengePhase.COMPLETE;
        if (challenge.isInOvertime()) return ChallengePhase.OVERTIME;

        Instant halftimeAt = challenge.getHalftimeAt();
        if (halftimeAt != null && !at.isBefore(halftimeAt)) {
            return at.isAfter(halftimeAt.plus(halftimeWindow)) ? ChallengePhase.SECOND_HALF : ChallengePhase.HALFTIME_WINDOW;
        }
        return challenge.isHalftimePassed() ? ChallengePhase.SECOND_HALF : ChallengePhase.FIRST_HALF;
    }
}
