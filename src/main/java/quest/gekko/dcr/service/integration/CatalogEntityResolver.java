package quest.gekko.dcr.service.integration;

import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import quest.gekko.dcr.config.CacheConfig;
import quest.gekko.dcr.domain.EntityType;
import quest.gekko.dcr.domain.MarketEntity;
import quest.gekko.dcr.repository.MarketEntityRepository;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class CatalogEntityResolver implements EntityResolver {
    private final MarketEntityRepository entityRepository;

    @Override
    @Cacheable(value = CacheConfig.ENTITY_IDS, key = "#type + ':' + #displayName", unless = "#result == null")
    public Optional<Long> resolve(EntityType type, String displayName) {
        if (displayName == null || displayName.isBlank()) return Optional.empty();
        return entityRepository.findByEntityTypeAndName(type, displayName.trim()).map(MarketEntity::getId);
    }
}
