package org.attrition.node.processes.http.api.game.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.attrition.engine.model.QueueItem;

import java.time.Instant;

/**
 * An admitted or in-flight item. Instants are ISO-8601 strings, {@code null} while unset.
 */
public record QueueItemDto(
    @JsonProperty("_id") String id,
    String queueType,
    String locationCoord,
    String catalogKey,
    int level,
    int quantity,
    String status,
    long creditsCost,
    String identityKey,
    String startedAt,
    String completesAt,
    Long etaSeconds
) {
    public static QueueItemDto from(final QueueItem item) {
        return new QueueItemDto(String.valueOf(item.id()), item.queueType().wireName(), item.coord(),
            item.catalogKey(), item.level(), item.quantity(), item.status(), item.creditsCost(), item.identityKey(),
            iso(item.startedAt()), iso(item.completesAt()), item.etaSeconds());
    }

    static String iso(final Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
