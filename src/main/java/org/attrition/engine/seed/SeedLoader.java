package org.attrition.engine.seed;

import com.typesafe.config.Config;
import org.attrition.engine.api.store.IGameStore;
import org.attrition.engine.model.Empire;
import org.attrition.engine.model.Location;
import org.attrition.engine.model.RecordKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads development fixtures from a {@code seed} block:
 *
 * <pre>
 * seed {
 *   empires   = [ { id = "e1", name = "Alpha", credits = 500, techLevels { energy = 2 } } ]
 *   locations = [ { coord = "A00:10:20:10", owner = "e1", solarEnergy = 3, gasYield = 2,
 *                   fertility = 5, metalYield = 2, area = 85 } ]
 *   records   = [ { empireId = "e1", coord = "A00:10:20:10", kind = "structure",
 *                   key = "urban_structures", level = 2 } ]
 * }
 * </pre>
 *
 * Existing empires and records are left untouched, so loading twice changes nothing.
 * Locations are written as configured.
 */
public final class SeedLoader {

    private static final Logger log = LoggerFactory.getLogger(SeedLoader.class);

    private SeedLoader() {
    }

    public static void load(IGameStore store, Config seed, Instant now) {
        int empires = 0;
        if (seed.hasPath("empires")) {
            for (Config empire : seed.getConfigList("empires")) {
                String id = empire.getString("id");
                if (store.findEmpire(id).isPresent()) {
                    continue;
                }
                Map<String, Integer> techLevels = new LinkedHashMap<>();
                if (empire.hasPath("techLevels")) {
                    Config techs = empire.getConfig("techLevels");
                    empire.getObject("techLevels").keySet().forEach(key -> techLevels.put(key, techs.getInt(key)));
                }
                store.saveEmpire(new Empire(id, empire.hasPath("name") ? empire.getString("name") : id,
                    empire.hasPath("credits") ? empire.getLong("credits") : 0, techLevels, now));
                empires++;
            }
        }
        int locations = 0;
        if (seed.hasPath("locations")) {
            for (Config location : seed.getConfigList("locations")) {
                store.saveLocation(new Location(location.getString("coord"),
                    location.hasPath("owner") ? location.getString("owner") : null,
                    intOrZero(location, "solarEnergy"), intOrZero(location, "gasYield"),
                    intOrZero(location, "fertility"), intOrZero(location, "metalYield"),
                    intOrZero(location, "area")));
                locations++;
            }
        }
        int records = 0;
        if (seed.hasPath("records")) {
            for (Config record : seed.getConfigList("records")) {
                RecordKind kind = RecordKind.valueOf(record.getString("kind").toUpperCase(Locale.ROOT));
                store.seedRecord(record.getString("empireId"), record.getString("coord"), kind,
                    record.getString("key"), record.getInt("level"));
                records++;
            }
        }
        log.info("Seed applied: {} new empire(s), {} location(s), {} record(s)", empires, locations, records);
    }

    private static int intOrZero(Config config, String path) {
        return config.hasPath(path) ? config.getInt(path) : 0;
    }
}
