package com.spendguard.core.pipeline;

import com.spendguard.core.SpendGuardException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The stages an engine is built from. Ids must be unique and non-blank since
 * they key both configuration ({@code spendguard.stages.<id>}) and per-request
 * skipping. Stages run by {@link PipelineStage#getOrder()}, ties broken by id.
 */
public class StageRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageRegistry.class);

    private static final Comparator<PipelineStage> RUN_ORDER = Comparator
            .comparingInt(PipelineStage::getOrder)
            .thenComparing(PipelineStage::getId);

    private final List<PipelineStage> stages;

    /**
     * @throws SpendGuardException if a stage has no id or two stages share one
     */
    public StageRegistry(List<PipelineStage> stages) {
        Map<String, PipelineStage> byId = new HashMap<>();
        for (PipelineStage stage : stages) {
            String id = stage.getId();
            if (id == null || id.isBlank())
                throw new SpendGuardException("Pipeline stage " + stage.getClass().getName() + " has no id");
            PipelineStage clash = byId.putIfAbsent(id, stage);
            if (clash != null)
                throw new SpendGuardException("Duplicate pipeline stage id '" + id + "': "
                        + clash.getClass().getName() + " and " + stage.getClass().getName());
        }

        List<PipelineStage> sorted = new ArrayList<>(stages);
        sorted.sort(RUN_ORDER);
        this.stages = List.copyOf(sorted);
    }

    /**
     * Stages that are switched on for this context, in run order.
     */
    public List<PipelineStage> getEnabledStages(StageContext context) {
        List<PipelineStage> enabled = new ArrayList<>();
        for (PipelineStage stage : stages) {
            if (stage.isEnabled(context))
                enabled.add(stage);
            else
                log.info("[SpendGuard] Stage '{}' disabled by configuration", stage.getId());
        }
        log.info("[SpendGuard] Pipeline: {}", enabled.isEmpty() ? "(no stages)"
                : enabled.stream().map(s -> s.getName() + "[" + s.getId() + ", order=" + s.getOrder() + "]")
                        .collect(Collectors.joining(" -> ")));
        return enabled;
    }
}
