package com.spendguard.core;

import com.spendguard.core.config.SpendGuardProperties;
import com.spendguard.core.event.CostTrackingListener;
import com.spendguard.core.event.ErrorReporter;
import com.spendguard.core.event.ResponseReceived;
import com.spendguard.core.model.AiRequestContext;
import com.spendguard.core.model.GuardOutcome;
import com.spendguard.core.model.ProviderResponse;
import com.spendguard.core.model.UsageRecord;
import com.spendguard.core.pipeline.PipelineStage;
import com.spendguard.core.pipeline.ProviderCall;
import com.spendguard.core.pipeline.StageChain;
import com.spendguard.core.pipeline.StageContext;
import com.spendguard.core.pipeline.StageRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for every guarded LLM call.
 * Runs the enabled stages in order on the caller's thread, invokes the
 * provider if they let the call through, then hands the reported usage to
 * cost tracking in the background.
 */
public class SpendGuardEngine {

    private static final Logger log = LoggerFactory.getLogger(SpendGuardEngine.class);

    private final StageContext context;
    private final SpendGuardProperties properties;
    private final CostTrackingListener costTracker;
    private final ErrorReporter errorReporter;
    private final Executor asyncExecutor;
    private final Clock clock;
    private final List<PipelineStage> stages;

    public SpendGuardEngine(StageRegistry registry, StageContext context, SpendGuardProperties properties,
            CostTrackingListener costTracker, ErrorReporter errorReporter, Executor asyncExecutor, Clock clock) {
        this.context = context;
        this.properties = properties;
        this.costTracker = costTracker;
        this.errorReporter = errorReporter;
        this.asyncExecutor = asyncExecutor;
        this.clock = clock;
        this.stages = List.copyOf(registry.getEnabledStages(context));
        log.info("[SpendGuard] Engine started in {} mode with {} active stage(s)", properties.getMode(), stages.size());
    }

    /**
     * Guard one provider call.
     *
     * @return the provider's response, or a denial if a stage refused the call
     *         (in which case the provider was not invoked)
     */
    public GuardOutcome execute(AiRequestContext request, ProviderCall providerCall) {
        if (!properties.isEnabled()) {
            return GuardOutcome.allowed(invokeProvider(request, providerCall));
        }

        long startedAt = System.nanoTime();
        StageChain terminal = req -> {
            long elapsedMicros = TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - startedAt);
            if (elapsedMicros > properties.getPerformanceTarget().toNanos() / 1_000) {
                log.warn("[SpendGuard] Pre-call stages took {}ms for request {} (target {}ms)",
                        elapsedMicros / 1_000.0, req.getRequestId(), properties.getPerformanceTarget().toMillis());
            }
            return GuardOutcome.allowed(invokeProvider(req, providerCall));
        };
        return link(0, terminal).proceed(request);
    }

    /**
     * Queue a completed call's usage for cost recording. Never blocks and
     * never throws; a full queue is reported, not dropped.
     */
    public void recordAsync(ResponseReceived event) {
        try {
            asyncExecutor.execute(() -> costTracker.onResponseReceived(event));
        } catch (RejectedExecutionException e) {
            errorReporter.taskRejected(event, e);
        }
    }

    public List<PipelineStage> getActiveStages() {
        return stages;
    }

    private StageChain link(int index, StageChain terminal) {
        if (index == stages.size())
            return terminal;
        PipelineStage stage = stages.get(index);
        StageChain next = link(index + 1, terminal);
        return request -> {
            if (request.isStageDisabled(stage.getId()))
                return next.proceed(request);

            boolean[] proceeded = { false };
            StageChain tracked = r -> {
                proceeded[0] = true;
                return next.proceed(r);
            };
            try {
                return stage.handle(request, context, tracked);
            } catch (RuntimeException e) {
                // Past this stage the exception belongs to the provider call
                if (proceeded[0])
                    throw e;
                log.error("[SpendGuard] Stage '{}' threw exception, skipping it: {}", stage.getId(), e.getMessage());
                return next.proceed(request);
            }
        };
    }

    private ProviderResponse invokeProvider(AiRequestContext request, ProviderCall providerCall) {
        ProviderResponse response = providerCall.call(request);
        if (response == null || !response.hasUsage()) {
            log.debug("[SpendGuard] No usage reported for request {}, nothing to record", request.getRequestId());
            return response;
        }
        UsageRecord usage = response.getUsage();
        if (usage.getProvider() == null || usage.getModel() == null) {
            usage = new UsageRecord(
                    usage.getProvider() != null ? usage.getProvider() : request.getProvider(),
                    usage.getModel() != null ? usage.getModel() : request.getModel(),
                    usage.getInputUnits(), usage.getOutputUnits());
        }
        recordAsync(new ResponseReceived(request.getRequestId(), request.getScopes(), usage, clock.instant()));
        return response;
    }
}
