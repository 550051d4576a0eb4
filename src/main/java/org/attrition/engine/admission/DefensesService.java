package org.attrition.engine.admission;

import org.attrition.engine.capacity.CapacityResult;
import org.attrition.engine.model.QueueType;

/**
 * Defense admission. Same record model as structures, built at the citizen rate, without
 * area or population checks.
 */
public class DefensesService extends RecordAdmissionPipeline {

    public DefensesService(AdmissionDependencies deps) {
        super(QueueType.DEFENSES, deps);
    }

    @Override
    protected CapacityResult capacityRate(AdmissionContext context) {
        return deps.capacityService().citizen(context.records());
    }

    @Override
    protected String capacityName() {
        return "citizen";
    }
}
