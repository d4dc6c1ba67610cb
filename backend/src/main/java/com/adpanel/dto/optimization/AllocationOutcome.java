package com.adpanel.dto.optimization;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/** Decisions a strategy produced for one daily row, plus the ones it dropped. */
@Data
public class AllocationOutcome {
    private final List<AllocationDecision> decisions = new ArrayList<>();
    private final List<AllocationDecision> discarded = new ArrayList<>();
    private String reason;

    public static AllocationOutcome empty(String reason) {
        AllocationOutcome outcome = new AllocationOutcome();
        outcome.setReason(reason);
        return outcome;
    }

    public BigDecimal getTotalAllocated() {
        return decisions.stream()
                .map(AllocationDecision::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean hasDecisions() {
        return !decisions.isEmpty();
    }
}
