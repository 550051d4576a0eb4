package org.attrition.node.processes.http.api.game.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.attrition.engine.admission.AdmissionRequest;

/**
 * Body of {@code POST {queue}/start}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StartRequestDto(String locationCoord, String catalogKey, Integer quantity) {

    public AdmissionRequest toRequest() {
        return new AdmissionRequest(locationCoord, catalogKey, quantity);
    }
}
