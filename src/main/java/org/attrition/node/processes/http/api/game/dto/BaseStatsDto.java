package org.attrition.node.processes.http.api.game.dto;

import org.attrition.engine.admission.EnergyProjection;
import org.attrition.engine.capacity.BaseCapacities;
import org.attrition.engine.ledger.SpaceUsage;
import org.attrition.engine.status.BaseStats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response of {@code bases/{coord}/stats}.
 */
public record BaseStatsDto(
    String locationCoord,
    Map<String, Long> energy,
    Map<String, Long> area,
    Map<String, Long> population,
    BaseCapacities capacities
) {
    public static BaseStatsDto from(final BaseStats stats) {
        return new BaseStatsDto(stats.coord(), energy(stats.energy()), space(stats.area()),
            space(stats.population()), stats.capacities());
    }

    private static Map<String, Long> energy(final EnergyProjection energy) {
        final Map<String, Long> map = new LinkedHashMap<>();
        map.put("produced", energy.produced());
        map.put("consumed", energy.consumed());
        map.put("balance", energy.balance());
        map.put("reservedNegative", energy.reservedNegative());
        map.put("reservedPositive", energy.reservedPositive());
        map.put("projected", energy.projectedEnergy());
        return map;
    }

    private static Map<String, Long> space(final SpaceUsage usage) {
        final Map<String, Long> map = new LinkedHashMap<>();
        map.put("capacity", usage.capacity());
        map.put("used", usage.used());
        map.put("reserved", usage.reserved());
        map.put("free", usage.free());
        return map;
    }
}
