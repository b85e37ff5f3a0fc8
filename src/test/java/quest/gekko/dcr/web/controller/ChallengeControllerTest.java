package quest.gekko.dcr.web.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import quest.gekko.dcr.domain.ChallengePhase;
import quest.gekko.dcr.domain.EntityType;
import quest.gekko.dcr.service.challenge.HalftimeService;
import quest.gekko.dcr.service.challenge.HalftimeSnapshot;
import quest.gekko.dcr.service.challenge.HalftimeStatus;
import quest.gekko.dcr.service.challenge.SubstitutionRequest;
import quest.gekko.dcr.service.challenge.SubstitutionResult;
import quest.gekko.dcr.service.challenge.SubstitutionService;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChallengeController.class)
class ChallengeControllerTest {
    private static final Instant HALFTIME = Instant.parse("2024-11-07T15:20:00Z");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private HalftimeService halftimeService;

    @MockBean
    private SubstitutionService substitutionService;

    @Test
    void halftimeStatusIsReturned() throws Exception {
        when(halftimeService.getHalftimeStatus(1L)).thenReturn(new HalftimeStatus(1L, ChallengePhase.HALFTIME_WINDOW,
                HALFTIME, HALFTIME.plusSeconds(61_200), 120, 95, true, false, true, 2.0, 24));

        mvc.perform(get("/api/challenges/1/halftime"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("HALFTIME_WINDOW"))
                .andExpect(jsonPath("$.halftimeScoreTeam1").value(120))
                .andExpect(jsonPath("$.powerHourMultiplier").value(2.0));
    }

    @Test
    void unknownChallengeIs404() throws Exception {
        mvc.perform(get("/api/challenges/99/halftime"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void snapshotIsReturnedOnceThenNoContent() throws Exception {
        when(halftimeService.takeHalftimeSnapshot(1L))
                .thenReturn(new HalftimeSnapshot(1L, HALFTIME, 10L, 120, 20L, 95))
                .thenReturn(null);

        mvc.perform(post("/api/challenges/1/halftime/snapshot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.team2Score").value(95));
        mvc.perform(post("/api/challenges/1/halftime/snapshot"))
                .andExpect(status().isNoContent());
    }

    @Test
    void timingsAfterHalftimeAreAConflict() throws Exception {
        when(halftimeService.initializeChallengeTimings(eq(1L), any(Instant.class)))
                .thenThrow(new IllegalStateException("Challenge 1 is past halftime; timings are fixed"));

        mvc.perform(post("/api/challenges/1/timings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startTime\":\"2024-11-07T08:00:00Z\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Challenge 1 is past halftime; timings are fixed"));
    }

    @Test
    void timingsWithoutStartAreABadRequest() throws Exception {
        mvc.perform(post("/api/challenges/1/timings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"durationHours\":4}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void acceptedSubstitution() throws Exception {
        when(substitutionService.makeSubstitution(new SubstitutionRequest(1L, 10L, "mfg1", EntityType.MANUFACTURER, 101L)))
                .thenReturn(new SubstitutionResult(true, "Substitution successful! 1 substitution(s) remaining.",
                        new SubstitutionResult.Change("mfg1", EntityType.MANUFACTURER, 100L, EntityType.MANUFACTURER, 101L), 1));

        mvc.perform(post("/api/challenges/1/substitutions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"teamId\":10,\"position\":\"mfg1\",\"newAssetType\":\"MANUFACTURER\",\"newAssetId\":101}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.remainingSubstitutions").value(1))
                .andExpect(jsonPath("$.substitution.oldAssetId").value(100));
    }

    @Test
    void rejectedSubstitutionIsUnprocessable() throws Exception {
        when(substitutionService.makeSubstitution(any()))
                .thenReturn(new SubstitutionResult(false, "Maximum 2 substitutions already used", null, null));

        mvc.perform(post("/api/challenges/1/substitutions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"teamId\":10,\"position\":\"flex\",\"newAssetType\":\"PRODUCT\",\"newAssetId\":301}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.remainingSubstitutions").doesNotExist());
    }

    @Test
    void remainingSubstitutions() throws Exception {
        when(substitutionService.getRemainingSubstitutions(1L, 10L)).thenReturn(2);

        mvc.perform(get("/api/challenges/1/teams/10/substitutions/remaining"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remainingSubstitutions").value(2));
    }
}
