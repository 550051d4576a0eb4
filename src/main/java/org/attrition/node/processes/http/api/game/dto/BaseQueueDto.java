package org.attrition.node.processes.http.api.game.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.attrition.engine.status.QueuedItemView;

import java.util.List;
import java.util.Map;

/**
 * Response of {@code bases/{coord}/queue}.
 */
public record BaseQueueDto(String locationCoord, List<Item> items) {

    /**
     * @param item   the in-flight item
     * @param energy its order-aware energy projection, omitted for research and units
     */
    public record Item(QueueItemDto item, @JsonInclude(JsonInclude.Include.NON_NULL) Map<String, Object> energy) {
    }

    public static BaseQueueDto from(final String coord, final List<QueuedItemView> views) {
        return new BaseQueueDto(coord, views.stream()
            .map(v -> new Item(QueueItemDto.from(v.item()), v.energy() == null ? null : v.energy().toDetails()))
            .toList());
    }
}
