package org.attrition.engine.model;

/**
 * A base location and its environment.
 *
 * @param coord          coordinate string, e.g. {@code A00:10:20:10}
 * @param ownerEmpireId  owning empire, or {@code null} if unowned
 * @param solarEnergy    energy per solar plant level; also a construction bonus in percent
 * @param gasYield       energy per gas plant level
 * @param fertility      population per urban structures level; also a research bonus in percent
 * @param metalYield     construction/production per metal refinery level
 * @param area           base area before terraforming
 */
public record Location(String coord, String ownerEmpireId, int solarEnergy, int gasYield,
                       int fertility, int metalYield, int area) {

    public boolean isOwnedBy(String empireId) {
        return ownerEmpireId != null && ownerEmpireId.equals(empireId);
    }
}
