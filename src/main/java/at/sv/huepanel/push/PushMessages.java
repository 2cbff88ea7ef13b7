package at.sv.huepanel.push;

import at.sv.huepanel.snapshot.Change;
import at.sv.huepanel.snapshot.Delta;
import at.sv.huepanel.snapshot.Snapshot;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes outbound and decodes inbound socket messages. All messages are JSON objects with a {@code type} field.
 */
public final class PushMessages {

    public static final String INITIAL_STATE = "initial_state";
    public static final String LIGHT_UPDATE = "light_update";
    public static final String ROOM_UPDATE = "room_update";
    public static final String ZONE_UPDATE = "zone_update";
    public static final String MOTION_UPDATE = "motion_update";
    public static final String PING = "ping";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    private final ObjectMapper mapper;

    public PushMessages() {
        this(createObjectMapper());
    }

    public PushMessages(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    public InboundMessage parse(String message) {
        try {
            InboundMessage inbound = mapper.readValue(message, InboundMessage.class);
            if (inbound == null || inbound.type() == null) {
                throw new InvalidMessageException("Missing message type", null);
            }
            return inbound;
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException("Malformed message", e);
        }
    }

    public String initialState(Snapshot snapshot) {
        return write(new InitialState(INITIAL_STATE, snapshot.lightList(), snapshot.roomList(),
                snapshot.zoneList(), snapshot.motionZoneList()));
    }

    /**
     * @return one message per entity kind with changes, in the order lights, rooms, zones, motion zones. Empty if the
     * delta is empty.
     */
    public List<String> updates(Delta delta) {
        List<String> messages = new ArrayList<>();
        if (!delta.lights().isEmpty()) {
            messages.add(update(LIGHT_UPDATE, delta.lights()));
        }
        if (!delta.rooms().isEmpty()) {
            messages.add(update(ROOM_UPDATE, delta.rooms()));
        }
        if (!delta.zones().isEmpty()) {
            messages.add(update(ZONE_UPDATE, delta.zones()));
        }
        if (!delta.motionZones().isEmpty()) {
            messages.add(update(MOTION_UPDATE, delta.motionZones()));
        }
        return messages;
    }

    private String update(String type, List<? extends Change<?>> changes) {
        List<JsonNode> changed = new ArrayList<>(changes.size());
        for (Change<?> change : changes) {
            if (change.removed()) {
                ObjectNode removed = mapper.createObjectNode();
                removed.put("id", change.id());
                removed.put("removed", true);
                changed.add(removed);
            } else {
                changed.add(mapper.valueToTree(change.entity()));
            }
        }
        return write(new Update(type, changed));
    }

    public String ping() {
        return write(new Simple(PING, null));
    }

    public String pong() {
        return write(new Simple(PONG, null));
    }

    public String error(String message) {
        return write(new Simple(ERROR, message));
    }

    private String write(Object message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize message: " + e.getMessage(), e);
        }
    }

    record InitialState(String type, List<?> lights, List<?> rooms, List<?> zones, List<?> motionZones) {
    }

    record Update(String type, List<JsonNode> changed) {
    }

    record Simple(String type, String message) {
    }
}
