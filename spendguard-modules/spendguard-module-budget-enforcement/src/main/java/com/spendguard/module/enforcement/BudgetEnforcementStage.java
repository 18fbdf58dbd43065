package com.spendguard.module.enforcement;

import com.spendguard.core.model.AiRequestContext;
import com.spendguard.core.model.BudgetDecision;
import com.spendguard.core.model.BudgetDenial;
import com.spendguard.core.model.CostBreakdown;
import com.spendguard.core.model.GuardOutcome;
import com.spendguard.core.model.PriceEntry;
import com.spendguard.core.model.UsageRecord;
import com.spendguard.core.pipeline.PipelineStage;
import com.spendguard.core.pipeline.StageChain;
import com.spendguard.core.pipeline.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Stops LLM calls that would blow a budget, before the provider is paid.
 *
 * For each request:
 * 1. Estimate the cost from the prompt length and the model's price
 * 2. Check the estimate against every limit of every scope (user, project, org)
 * 3. Refuse the call on the first limit it would break
 *
 * If the estimate or the check cannot be completed the call goes through:
 * a broken budget store must not take the product down with it.
 */
@Component
public class BudgetEnforcementStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(BudgetEnforcementStage.class);
    private static final String ID = "budget-enforcement";

    enum State {
        RECEIVED,
        ESTIMATING,
        CHECKING,
        ALLOWED,
        DENIED
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Budget Enforcement";
    }

    @Override
    public int getOrder() {
        return 100;
    }

    @Override
    public GuardOutcome handle(AiRequestContext request, StageContext context, StageChain chain) {
        State state = State.RECEIVED;
        AiRequestContext effective = request;
        BudgetDecision decision;
        try {
            effective = withDefaultModel(request, context);
            state = State.ESTIMATING;
            BigDecimal estimate = estimateCost(effective, context);
            state = State.CHECKING;
            decision = context.getBudgetLedger().check(effective.getScopes(), estimate,
                    effective.getPerRequestBudgetLimit());
        } catch (RuntimeException e) {
            log.warn("[SpendGuard] [{}] Budget check failed while {} for request {}, allowing: {}",
                    ID, state, request.getRequestId(), e.getMessage());
            GuardOutcome outcome = chain.proceed(effective);
            if (outcome.isDenied())
                return outcome;
            return GuardOutcome.allowed(outcome.getResponse(), BudgetDecision.failOpen(e.getMessage()));
        }

        state = decision.isDenied() ? State.DENIED : State.ALLOWED;
        if (state == State.DENIED) {
            BudgetDenial denial = decision.getDenial();
            if (context.getProperties().isActiveMode()) {
                log.warn("[SpendGuard] [{}] DENIED request {}: {}", ID, request.getRequestId(), denial.getReason());
                return GuardOutcome.denied(denial);
            }
            // Monitoring only, so log it and let the call through
            log.warn("[SpendGuard] [{}] WOULD HAVE DENIED request {}: {}", ID, request.getRequestId(), denial.getReason());
        }
        return chain.proceed(effective);
    }

    /**
     * Estimated cost of the request at the model's current price.
     */
    BigDecimal estimateCost(AiRequestContext request, StageContext context) {
        PriceEntry price = context.getPricingResolver().resolve(request.getProvider(), request.getModel());
        UsageRecord estimatedUsage = context.getTokenEstimator().estimate(request, price);
        CostBreakdown estimate = context.getCostCalculator().calculate(price, estimatedUsage);
        log.debug("[SpendGuard] [{}] Request {} estimated at {} {} ({} via {})", ID, request.getRequestId(),
                estimate.getTotalCost().toPlainString(), estimate.getCurrency(), request.getModel(), price.getSource());
        return estimate.getTotalCost();
    }

    private AiRequestContext withDefaultModel(AiRequestContext request, StageContext context) {
        if (request.getModel() != null && !request.getModel().isBlank())
            return request;
        String provider = request.getProvider().toLowerCase();
        String configured = context.getProperties().getPricing().getDefaultModels().get(provider);
        String model = configured != null
                ? configured
                : context.getPricingResolver().getCatalog().getDefaultModel(provider).orElse(null);
        if (model == null)
            return request;
        log.debug("[SpendGuard] [{}] No model on request {}, using {} default {}",
                ID, request.getRequestId(), provider, model);
        return request.withModel(model);
    }
}
