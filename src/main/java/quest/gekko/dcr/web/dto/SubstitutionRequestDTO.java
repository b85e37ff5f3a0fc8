package quest.gekko.dcr.web.dto;

import quest.gekko.dcr.domain.EntityType;

public record SubstitutionRequestDTO(Long teamId, String position, EntityType newAssetType, Long newAssetId) {}
