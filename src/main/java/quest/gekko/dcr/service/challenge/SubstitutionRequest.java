package quest.gekko.dcr.service.challenge;

import quest.gekko.dcr.domain.EntityType;

/**
 * @param position slot code such as {@code mfg1}, {@code cstr2} or {@code flex}
 */
public record SubstitutionRequest(Long challengeId, Long teamId, String position,
                                  EntityType newAssetType, Long newAssetId) {
}
