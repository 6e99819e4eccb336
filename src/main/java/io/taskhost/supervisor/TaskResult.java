package io.taskhost.supervisor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.taskhost.util.Jsons;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResult(
        boolean success,
        JsonNode data,
        String error,
        Integer code
) {
    public static TaskResult ok(JsonNode data) {
        return new TaskResult(true, data, null, null);
    }

    public static TaskResult fail(String error) {
        return new TaskResult(false, null, error, null);
    }

    public static TaskResult fail(String error, Integer code) {
        return new TaskResult(false, null, error, code);
    }

    public <T> T dataAs(Class<T> type) {
        if (data == null || data.isNull()) {
            return null;
        }
        return Jsons.mapper().convertValue(data, type);
    }

    public <T> T dataAs(TypeReference<T> type) {
        if (data == null || data.isNull()) {
            return null;
        }
        return Jsons.mapper().convertValue(data, type);
    }
}
