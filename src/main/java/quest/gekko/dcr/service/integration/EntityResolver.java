package quest.gekko.dcr.service.integration;

import quest.gekko.dcr.domain.EntityType;

import java.util.Optional;

public interface EntityResolver {
    Optional<Long> resolve(EntityType type, String displayName);
}
