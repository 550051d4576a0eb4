package org.attrition.engine.errors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A domain failure with a stable {@link ErrorCode} and a structured details map that is
 * returned to the caller unchanged.
 */
public class GameException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    public GameException(ErrorCode code, String message) {
        this(code, message, null);
    }

    public GameException(ErrorCode code, String message, Map<String, Object> details) {
        super(message);
        this.code = code;
        this.details = details == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * @return the details map, or {@code null} when the failure carries none
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    public static GameException notFound(String what, String id) {
        return new GameException(ErrorCode.NOT_FOUND, what + " not found: " + id);
    }

    public static GameException invalidField(String field, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", field);
        return new GameException(ErrorCode.INVALID_REQUEST, message, details);
    }
}
