package org.attrition.engine.admission;

import org.attrition.engine.model.QueueType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Routes admissions to the pipeline of their queue type.
 */
public class QueueAdmissions {

    private final Map<QueueType, QueueAdmissionPipeline> pipelines = new EnumMap<>(QueueType.class);

    public QueueAdmissions(AdmissionDependencies deps) {
        register(new StructuresService(deps));
        register(new DefensesService(deps));
        register(new ResearchService(deps));
        register(new UnitsService(deps));
    }

    private void register(QueueAdmissionPipeline pipeline) {
        pipelines.put(pipeline.getQueueType(), pipeline);
    }

    public AdmissionResult start(QueueType type, String empireId, AdmissionRequest request) {
        return pipeline(type).start(empireId, request);
    }

    public QueueAdmissionPipeline pipeline(QueueType type) {
        return pipelines.get(type);
    }
}
