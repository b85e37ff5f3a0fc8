package quest.gekko.dcr.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import quest.gekko.dcr.domain.Challenge;
import quest.gekko.dcr.service.challenge.HalftimeService;
import quest.gekko.dcr.service.challenge.HalftimeSnapshot;
import quest.gekko.dcr.service.challenge.HalftimeStatus;
import quest.gekko.dcr.service.challenge.SubstitutionRequest;
import quest.gekko.dcr.service.challenge.SubstitutionResult;
import quest.gekko.dcr.service.challenge.SubstitutionService;
import quest.gekko.dcr.web.dto.SubstitutionRequestDTO;
import quest.gekko.dcr.web.dto.TimingsRequest;

import java.util.Map;

@RestController
@RequestMapping("/api/challenges/{challengeId}")
@RequiredArgsConstructor
public class ChallengeController {
    private final HalftimeService halftimeService;
    private final SubstitutionService substitutionService;

    @GetMapping("/halftime")
    public HalftimeStatus halftime(@PathVariable Long challengeId) {
        HalftimeStatus status = halftimeService.getHalftimeStatus(challengeId);
        if (status == null) throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Challenge not found: " + challengeId);
        return status;
    }

    /** 200 with the snapshot when this call froze the scores, 204 when there was nothing (more) to freeze. */
    @PostMapping("/halftime/snapshot")
    public ResponseEntity<HalftimeSnapshot> snapshot(@PathVariable Long challengeId) {
        HalftimeSnapshot snapshot = halftimeService.takeHalftimeSnapshot(challengeId);
        return snapshot == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(snapshot);
    }

    @PostMapping("/timings")
    public HalftimeStatus timings(@PathVariable Long challengeId, @RequestBody TimingsRequest body) {
        if (body.startTime() == null) throw new IllegalArgumentException("startTime is required");
        Challenge c = body.durationHours() == null
                ? halftimeService.initializeChallengeTimings(challengeId, body.startTime())
                : halftimeService.initializeChallengeTimings(challengeId, body.startTime(), body.durationHours());
        return halftimeService.getHalftimeStatus(c.getId());
    }

    @PostMapping("/substitutions")
    public ResponseEntity<SubstitutionResult> substitute(@PathVariable Long challengeId, @RequestBody SubstitutionRequestDTO body) {
        SubstitutionResult result = substitutionService.makeSubstitution(new SubstitutionRequest(
                challengeId, body.teamId(), body.position(), body.newAssetType(), body.newAssetId()));
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.unprocessableEntity().body(result);
    }

    @GetMapping("/teams/{teamId}/substitutions/remaining")
    public Map<String, Integer> remaining(@PathVariable Long challengeId, @PathVariable Long teamId) {
        return Map.of("remainingSubstitutions", substitutionService.getRemainingSubstitutions(challengeId, teamId));
    }
}
