package quest.gekko.dcr.service.challenge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import quest.gekko.dcr.config.RankerProperties;
import quest.gekko.dcr.domain.Challenge;
import quest.gekko.dcr.domain.ChallengeStatus;
import quest.gekko.dcr.domain.EntityType;
import quest.gekko.dcr.domain.HalftimeSubstitution;
import quest.gekko.dcr.domain.LineupPosition;
import quest.gekko.dcr.domain.LineupSlot;
import quest.gekko.dcr.repository.ChallengeRepository;
import quest.gekko.dcr.repository.HalftimeSubstitutionRepository;
import quest.gekko.dcr.repository.LineupSlotRepository;
import quest.gekko.dcr.repository.RosterEntryRepository;

import java.time.Clock;
import java.util.Optional;

/**
 * Second-half lineup changes. Every rejection is returned as a failed {@link SubstitutionResult}, never thrown.
 *
 * <p>Each substitution runs in its own transaction holding a row lock on the challenge, so the budget check and the
 * ledger write of concurrent requests for the same challenge never interleave.
 */
@Slf4j
@Service
public class SubstitutionService {
    private final ChallengeRepository challengeRepository;
    private final HalftimeSubstitutionRepository substitutionRepository;
    private final LineupSlotRepository lineupRepository;
    private final RosterEntryRepository rosterRepository;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;
    private final int maxPerTeam;
    private final SubstitutionBudgetMode budgetMode;

    public SubstitutionService(final ChallengeRepository challengeRepository,
                               final HalftimeSubstitutionRepository substitutionRepository,
                               final LineupSlotRepository lineupRepository,
                               final RosterEntryRepository rosterRepository,
                               final Clock clock,
                               final PlatformTransactionManager transactionManager,
                               final RankerProperties.ChallengeRules rules) {
        this.challengeRepository = challengeRepository;
        this.substitutionRepository = substitutionRepository;
        this.lineupRepository = lineupRepository;
        this.rosterRepository = rosterRepository;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.maxPerTeam = rules.maxSubstitutionsPerTeam();
        this.budgetMode = rules.budgetMode() == null ? SubstitutionBudgetMode.PER_POSITION : rules.budgetMode();
    }

    @Transactional(readOnly = true)
    public int getRemainingSubstitutions(final Long challengeId, final Long teamId) {
        long used = switch (budgetMode) {
            case PER_POSITION -> substitutionRepository.countByChallengeIdAndTeamId(challengeId, teamId);
            case PER_CHANGE -> substitutionRepository.sumChangeCount(challengeId, teamId);
        };
        return (int) Math.max(0, maxPerTeam - used);
    }

    public SubstitutionResult makeSubstitution(final SubstitutionRequest request) {
        try {
            return transactionTemplate.execute(status -> apply(request));
        } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
            log.warn("Substitution for team {} at {} in challenge {} lost a concurrent update: {}",
                    request.teamId(), request.position(), request.challengeId(), e.getMessage());
            return SubstitutionResult.rejected("Another substitution for this team is in progress, please retry");
        }
    }

    private SubstitutionResult apply(final SubstitutionRequest request) {
        Challenge challenge = challengeRepository.findLockedById(request.challengeId()).orElse(null);
        if (challenge == null) return SubstitutionResult.rejected("Challenge not found");
        if (!challenge.isHalftimePassed()) return SubstitutionResult.rejected("Halftime has not passed yet. Wait for 4:20 PM!");
        if (challenge.getStatus() == ChallengeStatus.COMPLETE) return SubstitutionResult.rejected("Challenge is already complete");
        if (challenge.isInOvertime()) return SubstitutionResult.rejected("No substitutions allowed during overtime");

        int remaining = getRemainingSubstitutions(request.challengeId(), request.teamId());
        if (remaining <= 0) return SubstitutionResult.rejected("Maximum " + maxPerTeam + " substitutions already used");

        Optional<LineupPosition> position = LineupPosition.fromCode(request.position());
        if (position.isEmpty()) return SubstitutionResult.rejected("Invalid position: " + request.position());
        if (request.newAssetType() == null || request.newAssetId() == null) {
            return SubstitutionResult.rejected("New asset is not on your roster");
        }
        if (!rosterRepository.existsByTeamIdAndAssetTypeAndAssetId(request.teamId(), request.newAssetType(), request.newAssetId())) {
            return SubstitutionResult.rejected("New asset is not on your roster");
        }

        LineupSlot slot = lineupRepository.findByTeamIdAndPosition(request.teamId(), position.get()).orElse(null);
        if (slot == null || slot.isEmpty()) return SubstitutionResult.rejected("No asset found at this position");

        EntityType oldType = position.get().fixedType().orElse(slot.getAssetType());
        Long oldId = slot.getAssetId();

        HalftimeSubstitution record = substitutionRepository
                .findByChallengeIdAndTeamIdAndPosition(request.challengeId(), request.teamId(), position.get())
                .orElseGet(() -> {
                    HalftimeSubstitution fresh = new HalftimeSubstitution();
                    fresh.setChallengeId(request.challengeId());
                    fresh.setTeamId(request.teamId());
                    fresh.setPosition(position.get());
                    return fresh;
                });
        record.setOldAssetType(oldType);
        record.setOldAssetId(oldId);
        record.setNewAssetType(request.newAssetType());
        record.setNewAssetId(request.newAssetId());
        record.setChangeCount(record.getChangeCount() + 1);
        record.setCreatedAt(clock.instant());
        substitutionRepository.saveAndFlush(record);

        slot.setAssetType(request.newAssetType());
        slot.setAssetId(request.newAssetId());
        slot.setUpdatedAt(clock.instant());
        lineupRepository.save(slot);

        log.info("Substitution made: Team {} replaced {}:{} with {}:{} at {}", request.teamId(), oldType, oldId,
                request.newAssetType(), request.newAssetId(), position.get().code());
        return SubstitutionResult.accepted(
                new SubstitutionResult.Change(position.get().code(), oldType, oldId, request.newAssetType(), request.newAssetId()),
                remaining - 1);
    }
}
