package org.attrition.engine.admission;

import org.attrition.engine.capacity.CapacityResult;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.ledger.SpaceUsage;
import org.attrition.engine.model.QueueType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structure admission. Built at the construction rate; population and area are checked
 * against the free space left once every earlier in-flight structure has completed.
 */
public class StructuresService extends RecordAdmissionPipeline {

    public StructuresService(AdmissionDependencies deps) {
        super(QueueType.STRUCTURES, deps);
    }

    @Override
    protected CapacityResult capacityRate(AdmissionContext context) {
        return deps.capacityService().construction(context.empire(), context.location(), context.records());
    }

    @Override
    protected String capacityName() {
        return "construction";
    }

    @Override
    protected void checkCapacity(AdmissionContext context) {
        int population = context.spec().populationCost();
        if (population > 0) {
            SpaceUsage usage = deps.ledger().population(context.location(), context.records());
            if (population > usage.projectedFree()) {
                throw new GameException(ErrorCode.INSUFFICIENT_POPULATION,
                    "Insufficient population for " + context.spec().displayName() + ".",
                    spaceDetails(population, usage));
            }
        }
        int area = context.spec().areaCost();
        if (area > 0) {
            SpaceUsage usage = deps.ledger().area(context.location(), context.records());
            if (area > usage.projectedFree()) {
                throw new GameException(ErrorCode.INSUFFICIENT_AREA,
                    "Insufficient area for " + context.spec().displayName() + ".",
                    spaceDetails(area, usage));
            }
        }
    }

    private static Map<String, Object> spaceDetails(int required, SpaceUsage usage) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("required", required);
        details.put("used", usage.used());
        details.put("capacity", usage.capacity());
        details.put("free", usage.free());
        details.put("projectedFreeAtStart", usage.projectedFree());
        return details;
    }
}
