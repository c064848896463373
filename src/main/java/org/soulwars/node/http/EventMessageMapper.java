package org.soulwars.node.http;

import java.util.List;

import org.soulwars.runtime.event.GameEvent;
import org.soulwars.runtime.snapshot.WorldSnapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Turns events and snapshots into the JSON messages pushed to observers.
 * <p>
 * Every message is an object with a {@code type} field holding the event's wire name, followed by the
 * event's payload fields. A tick's events travel as one JSON array; the full world travels as a
 * {@code world_state} message.
 * </p>
 */
public class EventMessageMapper {

    public static final String WORLD_STATE = "world_state";

    private final ObjectMapper mapper;

    public EventMessageMapper(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode toMessage(GameEvent event) {
        ObjectNode message = mapper.createObjectNode();
        message.put("type", event.type().wireName());
        JsonNode payload = mapper.valueToTree(event);
        if (payload instanceof ObjectNode fields) {
            message.setAll(fields);
        }
        return message;
    }

    /**
     * @return the events as a JSON array, in the given order
     */
    public String eventBatch(List<GameEvent> events) {
        ArrayNode batch = mapper.createArrayNode();
        for (GameEvent event : events) {
            batch.add(toMessage(event));
        }
        return write(batch);
    }

    public String worldState(WorldSnapshot snapshot) {
        ObjectNode message = mapper.createObjectNode();
        message.put("type", WORLD_STATE);
        message.set("world", mapper.valueToTree(snapshot));
        return write(message);
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize message", e);
        }
    }
}
