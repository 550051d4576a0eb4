package org.attrition.engine.capacity;

import org.attrition.engine.api.store.IGameStore;
import org.attrition.engine.catalog.Catalog;
import org.attrition.engine.errors.ErrorCode;
import org.attrition.engine.errors.GameException;
import org.attrition.engine.ledger.ResourceLedger;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.Empire;
import org.attrition.engine.model.Location;
import org.attrition.engine.model.RecordKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class CapacityServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Location BASE = new Location("A00:10:20:10", "empire-1", 3, 2, 5, 2, 85);

    @Mock
    private IGameStore store;

    private CapacityService service() {
        return new CapacityService(store, new ResourceLedger(new Catalog(), 2), CapacityBaselines.defaults());
    }

    private static BaseRecord structure(String key, int level) {
        return new BaseRecord(level, RecordKind.STRUCTURE, "empire-1", BASE.coord(), key, level, true, false, 0, 0,
            null, null, null, NOW);
    }

    private static Empire empire(Map<String, Integer> techs) {
        return new Empire("empire-1", "First", 0, techs, NOW);
    }

    @Test
    @DisplayName("An empty base builds at the baseline plus the solar bonus")
    void construction_baselineOnly() {
        CapacityResult result = service().construction(empire(Map.of()), BASE, List.of());

        assertThat(result.value()).isCloseTo(41.2, within(1e-9));
        assertThat(result.breakdown()).extracting(BreakdownItem::source).containsExactly("baseline", "solarEnergy");
    }

    @Test
    @DisplayName("Factories and refineries add flat rates, cybernetics and solar energy add percentages")
    void construction_withFactoriesAndCybernetics() {
        List<BaseRecord> records = List.of(structure("robotic_factories", 2), structure("metal_refineries", 3));

        CapacityResult result = service().construction(empire(Map.of("cybernetics", 1)), BASE, records);

        // (40 + 2*2 + 3*2) * (1 + 0.05 + 0.03)
        assertThat(result.value()).isCloseTo(54.0, within(1e-9));
        assertThat(result.breakdown()).contains(
            BreakdownItem.flat("robotic_factories", 4),
            BreakdownItem.flat("metal_refineries", 6),
            BreakdownItem.percent("cybernetics", 5));
    }

    @Test
    void production_isZeroWithoutFacilities() {
        assertThat(service().production(empire(Map.of()), BASE, List.of()).value()).isZero();

        CapacityResult withShipyard = service().production(empire(Map.of()), BASE, List.of(structure("shipyards", 1)));
        assertThat(withShipyard.value()).isCloseTo(2.04, within(1e-9));
    }

    @Test
    void research_usesLabsAndFertility() {
        CapacityResult result = service().research(empire(Map.of("artificial_intelligence", 2)), BASE,
            List.of(structure("research_labs", 2)));

        assertThat(result.value()).isCloseTo(16 * 1.10, within(1e-9));
    }

    @Test
    void citizen_sumsHousingStructures() {
        CapacityResult result = service().citizen(List.of(structure("urban_structures", 4),
            structure("command_centers", 2), structure("capital", 1)));

        assertThat(result.value()).isEqualTo(12 + 2 + 8);
    }

    @Test
    @DisplayName("Base capacities are read from the store on every call")
    void getBaseCapacities_loadsBase() {
        when(store.findEmpire("empire-1")).thenReturn(Optional.of(empire(Map.of())));
        when(store.findLocation(BASE.coord())).thenReturn(Optional.of(BASE));
        when(store.findRecords("empire-1", BASE.coord())).thenReturn(List.of(structure("research_labs", 1)));

        BaseCapacities capacities = service().getBaseCapacities("empire-1", BASE.coord());

        assertThat(capacities.research().value()).isCloseTo(8.4, within(1e-9));
        assertThat(capacities.production().value()).isZero();
    }

    @Test
    void getBaseCapacities_unknownLocation() {
        when(store.findEmpire("empire-1")).thenReturn(Optional.of(empire(Map.of())));
        when(store.findLocation("nowhere")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service().getBaseCapacities("empire-1", "nowhere"))
            .isInstanceOfSatisfying(GameException.class, e -> assertThat(e.getCode()).isEqualTo(ErrorCode.NOT_FOUND));
    }
}
