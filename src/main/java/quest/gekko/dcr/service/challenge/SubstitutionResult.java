package quest.gekko.dcr.service.challenge;

import com.fasterxml.jackson.annotation.JsonInclude;
import quest.gekko.dcr.domain.EntityType;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubstitutionResult(boolean success, String message, Change substitution, Integer remainingSubstitutions) {

    public record Change(String position,
                         EntityType oldAssetType, Long oldAssetId,
                         EntityType newAssetType, Long newAssetId) {}

    static SubstitutionResult rejected(String message) {
        return new SubstitutionResult(false, message, null, null);
    }

    static SubstitutionResult accepted(Change change, int remaining) {
        return new SubstitutionResult(true,
                "Substitution successful! " + remaining + " substitution(s) remaining.", change, remaining);
    }
}
