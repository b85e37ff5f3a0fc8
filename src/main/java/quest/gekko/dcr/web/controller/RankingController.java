package quest.gekko.dcr.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.dcr.domain.EntityStat;
import quest.gekko.dcr.domain.EntityType;
import quest.gekko.dcr.domain.MarketEntity;
import quest.gekko.dcr.repository.MarketEntityRepository;
import quest.gekko.dcr.service.core.StatsService;
import quest.gekko.dcr.web.dto.RankingEntryDTO;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/rankings")
@RequiredArgsConstructor
public class RankingController {
    private final StatsService statsService;
    private final MarketEntityRepository entityRepo;

    @GetMapping("/{type}")
    public List<RankingEntryDTO> ranking(@PathVariable EntityType type,
                                         @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        List<EntityStat> stats = statsService.rankingFor(type, date);
        Map<Long, String> names = entityRepo.findAllById(stats.stream().map(EntityStat::getEntityId).toList()).stream()
                .collect(Collectors.toMap(MarketEntity::getId, MarketEntity::getName, (a, b) -> a));
        return stats.stream()
                .map(s -> RankingEntryDTO.of(s, names.get(s.getEntityId())))
                .toList();
    }
}
