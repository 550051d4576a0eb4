package org.attrition.engine.status;

import org.attrition.engine.model.Empire;

import java.util.Map;

/**
 * @param empire        the empire
 * @param incomePerHour credits earned per hour across all owned bases
 * @param units         unit counts per base coordinate
 */
public record EmpireView(Empire empire, long incomePerHour, Map<String, Map<String, Long>> units) {
}
