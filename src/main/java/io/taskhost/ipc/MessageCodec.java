package io.taskhost.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.taskhost.util.Jsons;

/**
 * Newline framing for {@link WorkerMessage}: one compact JSON object per line.
 */
public final class MessageCodec {
    private MessageCodec() {
    }

    public static String encode(WorkerMessage message) {
        try {
            return Jsons.compactMapper().writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode worker message: " + message.type(), e);
        }
    }

    public static WorkerMessage decode(String line) throws MalformedMessageException {
        if (line == null || line.isBlank()) {
            throw new MalformedMessageException("empty message line");
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            throw new MalformedMessageException("not a JSON object");
        }
        try {
            WorkerMessage message = Jsons.compactMapper().readValue(trimmed, WorkerMessage.class);
            if (message == null || message.type() == null) {
                throw new MalformedMessageException("message without type");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("invalid JSON: " + e.getOriginalMessage());
        }
    }

    public static final class MalformedMessageException extends Exception {
        public MalformedMessageException(String message) {
            super(message);
        }
    }
}
