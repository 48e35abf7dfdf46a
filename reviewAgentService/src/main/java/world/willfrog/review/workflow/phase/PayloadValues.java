package world.willfrog.review.workflow.phase;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class PayloadValues {

    private PayloadValues() {
    }

    /**
     * status 为 error，或带有非空 error 字段（server 异常时只返回 {"error": ...}）。
     */
    static boolean reportsError(Map<String, Object> payload) {
        if (payload == null) {
            return false;
        }
        if ("error".equals(String.valueOf(payload.get("status")))) {
            return true;
        }
        Object error = payload.get("error");
        if (error instanceof String text) {
            return !text.isBlank();
        }
        if (error instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return error != null && !Boolean.FALSE.equals(error);
    }

    static List<Map<String, Object>> maps(Object value) {
        List<Map<String, Object>> result = new ArrayList<>();
        if (!(value instanceof List<?> list)) {
            return result;
        }
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                Map<String, Object> copy = new LinkedHashMap<>();
                map.forEach((key, val) -> copy.put(String.valueOf(key), val));
                result.add(copy);
            }
        }
        return result;
    }

    static List<Object> list(Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        return new ArrayList<>();
    }

    static String label(Map<String, Object> document) {
        for (String key : List.of("document_id", "description", "url", "path")) {
            Object value = document.get(key);
            if (value != null && !String.valueOf(value).isBlank()) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(document);
    }

    static String fileName(String path) {
        if (path == null) {
            return "";
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
