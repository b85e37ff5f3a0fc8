package quest.gekko.dcr.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.dcr.service.challenge.HalftimeService;
import quest.gekko.dcr.service.challenge.HalftimeSnapshot;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChallengeScheduler {
    private final HalftimeService halftimeService;

    /** Takes the halftime snapshot of every active challenge that has reached halftime. Safe to overlap. */
    @Scheduled(fixedDelayString = "${challenge.halftime-sweep-millis:60000}")
    public int sweepHalftimes() {
        int taken = 0;
        for (Long id : halftimeService.challengesDueForSnapshot()) {
            try {
                HalftimeSnapshot snapshot = halftimeService.takeHalftimeSnapshot(id);
                if (snapshot != null) taken++;
            } catch (RuntimeException e) {
                log.error("Halftime snapshot for challenge {} failed", id, e);
            }
        }
        if (taken > 0) log.info("Took {} halftime snapshot(s)", taken);
        return taken;
    }
}
