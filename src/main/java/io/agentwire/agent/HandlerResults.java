package io.agentwire.agent;

import java.util.LinkedHashMap;
import java.util.Map;

public final class HandlerResults {
    public static final String STATUS = "status";
    public static final String MESSAGE = "message";
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    private HandlerResults() {
    }

    public static Map<String, Object> success(Map<String, Object> fields) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(STATUS, SUCCESS);
        if (fields != null) {
            fields.forEach((key, value) -> {
                if (!STATUS.equals(key)) {
                    out.put(key, value);
                }
            });
        }
        return out;
    }

    public static Map<String, Object> error(String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(STATUS, ERROR);
        out.put(MESSAGE, message == null ? "" : message);
        return out;
    }

    public static boolean isSuccess(Map<String, Object> payload) {
        return payload != null && SUCCESS.equals(payload.get(STATUS));
    }
}
