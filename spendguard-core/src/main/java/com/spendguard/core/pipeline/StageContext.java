package com.spendguard.core.pipeline;

import com.spendguard.core.budget.BudgetLedger;
import com.spendguard.core.config.SpendGuardProperties;
import com.spendguard.core.cost.CostCalculator;
import com.spendguard.core.cost.TokenEstimator;
import com.spendguard.core.pricing.PricingResolver;

/**
 * Shared services handed to each PipelineStage.
 */
public class StageContext {

    private final PricingResolver pricingResolver;
    private final CostCalculator costCalculator;
    private final TokenEstimator tokenEstimator;
    private final BudgetLedger budgetLedger;
    private final SpendGuardProperties properties;

    public StageContext(PricingResolver pricingResolver, CostCalculator costCalculator,
            TokenEstimator tokenEstimator, BudgetLedger budgetLedger, SpendGuardProperties properties) {
        this.pricingResolver = pricingResolver;
        this.costCalculator = costCalculator;
        this.tokenEstimator = tokenEstimator;
        this.budgetLedger = budgetLedger;
        this.properties = properties;
    }

    public PricingResolver getPricingResolver() {
        return pricingResolver;
    }

    public CostCalculator getCostCalculator() {
        return costCalculator;
    }

    public TokenEstimator getTokenEstimator() {
        return tokenEstimator;
    }

    /** Limits and current spend, cached. */
    public BudgetLedger getBudgetLedger() {
        return budgetLedger;
    }

    public SpendGuardProperties getProperties() {
        return properties;
    }
}
