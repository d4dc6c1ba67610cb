package com.adpanel.entity;

/**
 * Budget distribution strategy of a plan. SCORE_PROPORTIONAL spreads the envelope over content by
 * score (ACE plans); GROUP_TIER scales configured style budgets of ad groups by score tier (ABX
 * plans).
 */
public enum AllocationStrategyType {
    SCORE_PROPORTIONAL,
    GROUP_TIER
}
