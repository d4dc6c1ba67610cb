package com.adpanel.dto.optimization;

import com.adpanel.entity.AllocationStrategyType;
import java.io.Serializable;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One computed (target, score, amount) tuple. For score-proportional runs the target is a content
 * item, for group-tier runs an ad group.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllocationDecision implements Serializable {
    private AllocationStrategyType strategy;
    private Long targetId;
    private String externalTargetId;
    private String targetName;
    private BigDecimal score;
    private BigDecimal multiplier;
    private BigDecimal amount;
    /** Budget on the platform before write-back; only set on applied entries. */
    private BigDecimal previousAmount;
    private String note;
}
