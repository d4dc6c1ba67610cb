package com.adpanel.service.optimization;

import com.adpanel.client.AdPlatformConnector;
import com.adpanel.config.AppProperties;
import com.adpanel.dto.optimization.AllocationDecision;
import com.adpanel.dto.platform.BudgetUpdate;
import com.adpanel.dto.platform.EntityKind;
import com.adpanel.dto.platform.FetchResult;
import com.adpanel.dto.platform.PlatformAdGroup;
import com.adpanel.dto.platform.WriteResult;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.AdGroup;
import com.adpanel.entity.AllocationStrategyType;
import com.adpanel.entity.OptimizationLog;
import com.adpanel.entity.OptimizationStatus;
import com.adpanel.entity.Platform;
import com.adpanel.exception.PlatformWriteDisabledException;
import com.adpanel.exception.ResourceNotFoundException;
import com.adpanel.repository.jpa.AdGroupRepository;
import com.adpanel.repository.jpa.OptimizationLogRepository;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Pushes the ad-group budgets of a completed group-tier log to the platform. Disabled unless
 * {@code app.optimizer.write-back.enabled} is set and never scheduled. Budgets read before the
 * write are stored with the outcome in a new log entry, which serves as the rollback record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AllocationActuator {

    private final OptimizationLogRepository optimizationLogRepository;
    private final AdGroupRepository adGroupRepository;
    private final List<AdPlatformConnector> connectors;
    private final AppProperties appProperties;

    public OptimizationLog apply(Long logId) {
        if (!appProperties.getOptimizer().getWriteBack().isEnabled()) {
            throw new PlatformWriteDisabledException(logId);
        }

        OptimizationLog source =
                optimizationLogRepository
                        .findById(logId)
                        .orElseThrow(() -> new ResourceNotFoundException("OptimizationLog", logId));
        if (source.getStrategy() != AllocationStrategyType.GROUP_TIER) {
            throw new IllegalStateException(
                    "Only group-tier logs carry ad-group budgets, log " + logId + " is " + source.getStrategy());
        }
        if (source.getStatus() != OptimizationStatus.COMPLETED) {
            throw new IllegalStateException("Log " + logId + " is " + source.getStatus() + ", not COMPLETED");
        }
        if (!optimizationLogRepository
                .findBySourceLogIdAndStatus(logId, OptimizationStatus.APPLIED)
                .isEmpty()) {
            throw new IllegalStateException("Log " + logId + " was already applied");
        }

        Map<Long, AdGroup> adGroups =
                adGroupRepository
                        .findAllWithAccountByIdIn(
                                source.getDecisions().stream()
                                        .map(AllocationDecision::getTargetId)
                                        .collect(Collectors.toList()))
                        .stream()
                        .collect(Collectors.toMap(AdGroup::getId, Function.identity()));

        Map<Long, AdAccount> accounts = new LinkedHashMap<>();
        Map<Long, List<AllocationDecision>> byAccount = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        for (AllocationDecision decision : source.getDecisions()) {
            AdGroup adGroup = adGroups.get(decision.getTargetId());
            if (adGroup == null) {
                errors.add("ad group " + decision.getTargetId() + " no longer exists");
                continue;
            }
            AdAccount account = adGroup.getCampaign().getAdAccount();
            accounts.putIfAbsent(account.getId(), account);
            byAccount.computeIfAbsent(account.getId(), id -> new ArrayList<>()).add(decision);
        }

        List<AllocationDecision> applied = new ArrayList<>();
        int written = 0;
        for (Map.Entry<Long, List<AllocationDecision>> entry : byAccount.entrySet()) {
            AdAccount account = accounts.get(entry.getKey());
            try {
                written +=
                        applyToAccount(
                                account,
                                connector(account.getPlatform()),
                                entry.getValue(),
                                adGroups,
                                applied,
                                errors);
            } catch (Exception e) {
                log.error("Write-back to account {} failed: {}", account.getId(), e.getMessage(), e);
                errors.add("account " + account.getExternalAccountId() + ": " + e.getMessage());
            }
        }

        OptimizationStatus status = errors.isEmpty() ? OptimizationStatus.APPLIED : OptimizationStatus.FAILED;
        OptimizationLog result =
                optimizationLogRepository.save(
                        OptimizationLog.builder()
                                .budgetPlanId(source.getBudgetPlanId())
                                .budgetAllocationId(source.getBudgetAllocationId())
                                .dailyBudgetId(source.getDailyBudgetId())
                                .sourceLogId(source.getId())
                                .budgetDate(source.getBudgetDate())
                                .strategy(source.getStrategy())
                                .status(status)
                                .envelope(source.getEnvelope())
                                .totalAllocated(
                                        applied.stream()
                                                .map(AllocationDecision::getAmount)
                                                .reduce(BigDecimal.ZERO, BigDecimal::add))
                                .changesMade(written)
                                .decisions(applied)
                                .reason(errors.isEmpty() ? null : String.join("; ", errors))
                                .build());

        log.info(
                "Write-back of log {}: {} of {} budgets written, status {}",
                logId,
                written,
                source.getDecisions().size(),
                status);
        return result;
    }

    private int applyToAccount(
            AdAccount account,
            AdPlatformConnector connector,
            List<AllocationDecision> decisions,
            Map<Long, AdGroup> adGroups,
            List<AllocationDecision> applied,
            List<String> errors) {
        List<String> externalIds =
                decisions.stream().map(AllocationDecision::getExternalTargetId).collect(Collectors.toList());

        FetchResult<PlatformAdGroup> current =
                connector.fetchByIds(account.getExternalAccountId(), EntityKind.AD_GROUP, externalIds);
        if (current.hasError()) {
            errors.add(
                    "reading current budgets of account "
                            + account.getExternalAccountId()
                            + ": "
                            + current.getErrorMessage());
            return 0;
        }
        Map<String, BigDecimal> previous = new LinkedHashMap<>();
        current.getItems().forEach(g -> previous.put(g.externalId(), g.budget()));

        List<BudgetUpdate> updates =
                decisions.stream()
                        .map(d -> new BudgetUpdate(d.getExternalTargetId(), d.getAmount()))
                        .collect(Collectors.toList());
        WriteResult result = connector.updateAdGroupBudgets(account.getExternalAccountId(), updates);
        Set<String> failedIds = new HashSet<>(result.failedIds());
        if (!result.isFullSuccess()) {
            errors.add("account " + account.getExternalAccountId() + ": " + result.errorMessage());
        }

        int written = 0;
        for (AllocationDecision decision : decisions) {
            if (failedIds.contains(decision.getExternalTargetId())) {
                continue;
            }
            applied.add(
                    AllocationDecision.builder()
                            .strategy(decision.getStrategy())
                            .targetId(decision.getTargetId())
                            .externalTargetId(decision.getExternalTargetId())
                            .targetName(decision.getTargetName())
                            .score(decision.getScore())
                            .multiplier(decision.getMultiplier())
                            .amount(decision.getAmount())
                            .previousAmount(previous.get(decision.getExternalTargetId()))
                            .note(decision.getNote())
                            .build());

            AdGroup adGroup = adGroups.get(decision.getTargetId());
            adGroup.setBudget(decision.getAmount());
            adGroupRepository.save(adGroup);
            written++;
        }
        return written;
    }

    private AdPlatformConnector connector(Platform platform) {
        return connectors.stream()
                .filter(c -> c.platform() == platform)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No connector for " + platform));
    }
}
