package quest.gekko.dcr.repository;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import quest.gekko.dcr.domain.EntityStat;
import quest.gekko.dcr.domain.EntityType;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class EntityStatRepositoryTest {
    private static final LocalDate DATE = LocalDate.of(2024, 11, 7);

    @Autowired
    private EntityStatRepository statRepository;

    private EntityStat stat(EntityType type, long entityId, LocalDate date, int rank) {
        EntityStat s = new EntityStat();
        s.setEntityType(type);
        s.setEntityId(entityId);
        s.setStatDate(date);
        s.setRank(rank);
        s.setUpdatedAt(Instant.parse("2024-11-07T15:00:00Z"));
        return s;
    }

    @Test
    void rankingIsOrderedByRankWithinTypeAndDate() {
        statRepository.save(stat(EntityType.STRAIN, 2L, DATE, 2));
        statRepository.save(stat(EntityType.STRAIN, 1L, DATE, 1));
        statRepository.save(stat(EntityType.STRAIN, 3L, DATE.minusDays(1), 1));
        statRepository.save(stat(EntityType.PRODUCT, 4L, DATE, 1));
        statRepository.flush();

        assertThat(statRepository.findByEntityTypeAndStatDateOrderByRankAsc(EntityType.STRAIN, DATE))
                .extracting(EntityStat::getEntityId)
                .containsExactly(1L, 2L);
    }

    @Test
    void historyWindowIsNewestFirst() {
        statRepository.save(stat(EntityType.STRAIN, 1L, DATE.minusDays(3), 4));
        statRepository.save(stat(EntityType.STRAIN, 1L, DATE.minusDays(1), 2));
        statRepository.save(stat(EntityType.STRAIN, 1L, DATE, 1));
        statRepository.flush();

        assertThat(statRepository.findByEntityTypeAndEntityIdAndStatDateBetweenOrderByStatDateDesc(
                EntityType.STRAIN, 1L, DATE.minusDays(30), DATE.minusDays(1)))
                .extracting(EntityStat::getRank)
                .containsExactly(2, 4);
    }

    @Test
    void oneRowPerEntityAndDate() {
        statRepository.saveAndFlush(stat(EntityType.PHARMACY, 1L, DATE, 1));

        assertThatThrownBy(() -> statRepository.saveAndFlush(stat(EntityType.PHARMACY, 1L, DATE, 2)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
