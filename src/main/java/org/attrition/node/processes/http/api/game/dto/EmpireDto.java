package org.attrition.node.processes.http.api.game.dto;

import org.attrition.engine.status.EmpireView;

import java.util.Map;

/**
 * Response of {@code empire}.
 */
public record EmpireDto(
    String id,
    String name,
    long credits,
    Map<String, Integer> techLevels,
    long incomePerHour,
    Map<String, Map<String, Long>> units,
    String lastIncomeAt
) {
    public static EmpireDto from(final EmpireView view) {
        return new EmpireDto(view.empire().id(), view.empire().name(), view.empire().credits(),
            view.empire().techLevels(), view.incomePerHour(), view.units(),
            QueueItemDto.iso(view.empire().lastIncomeAt()));
    }
}
