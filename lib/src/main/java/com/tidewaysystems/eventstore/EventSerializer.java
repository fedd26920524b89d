package com.tidewaysystems.eventstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tidewaysystems.eventstore.upcast.UpcasterChain;
import com.tidewaysystems.message.Event;
import com.tidewaysystems.message.MessageMetadata;

import java.util.Objects;

/**
 * Converts events to {@link StoredEvent} records and back, and snapshot state to and from JSON trees.
 *
 * <p>Metadata is kept in the record columns, not in the payload. On read the payload is
 * upcast to the type's current schema version before it is bound to the event class.
 */
public class EventSerializer {

    static final String METADATA_FIELD = "metadata";

    private final ObjectMapper mapper;
    private final EventTypeRegistry typeRegistry;
    private final UpcasterChain upcasters;

    public EventSerializer() {
        this(new EventTypeRegistry(), new UpcasterChain());
    }

    public EventSerializer(EventTypeRegistry typeRegistry, UpcasterChain upcasters) {
        this(createMapper(), typeRegistry, upcasters);
    }

    public EventSerializer(ObjectMapper mapper, EventTypeRegistry typeRegistry, UpcasterChain upcasters) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.typeRegistry = Objects.requireNonNull(typeRegistry, "typeRegistry cannot be null");
        this.upcasters = Objects.requireNonNull(upcasters, "upcasters cannot be null");
    }

    public static ObjectMapper createMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes an event into a record at the given stream position.
     *
     * @throws EventSerializationException if Jackson cannot serialize the event
     */
    public StoredEvent toRecord(String streamId, long version, Event event) {
        Class<? extends Event> eventClass = event.getClass();
        String typeName = typeRegistry.typeNameOf(eventClass);
        MessageMetadata metadata = event.metadata();
        String payload;
        try {
            JsonNode tree = mapper.valueToTree(event);
            if (!(tree instanceof ObjectNode)) {
                throw new IllegalArgumentException("Event must serialize to a JSON object: " + eventClass.getName());
            }
            ((ObjectNode) tree).remove(METADATA_FIELD);
            payload = mapper.writeValueAsString(tree);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw EventSerializationException.serializeFailed(typeName, e);
        }
        return new StoredEvent(metadata.id(), streamId, version, typeName,
            typeRegistry.currentSchemaVersionOf(eventClass), payload,
            metadata.occurredAt(), metadata.correlationId(), metadata.causationId());
    }

    /**
     * Reads a record back into its event, upcasting the payload first when needed.
     *
     * @throws com.tidewaysystems.eventstore.upcast.UnknownSchemaVersionException if no upcast path exists
     * @throws EventSerializationException if the payload cannot be bound
     */
    public Event toEvent(StoredEvent record) {
        String typeName = record.typeName();
        Class<? extends Event> eventClass = typeRegistry.classFor(typeName);
        int currentVersion = typeRegistry.currentSchemaVersion(typeName);
        ObjectNode payload;
        try {
            JsonNode tree = mapper.readTree(record.payload());
            if (!(tree instanceof ObjectNode)) {
                throw new IllegalArgumentException("Stored payload is not a JSON object");
            }
            payload = (ObjectNode) tree;
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw EventSerializationException.deserializeFailed(typeName, e);
        }
        ObjectNode upcast = upcasters.upcast(typeName, record.schemaVersion(), currentVersion, payload);
        MessageMetadata metadata = new MessageMetadata(record.eventId(), record.occurredAt(),
            record.correlationId(), record.causationId());
        upcast.set(METADATA_FIELD, mapper.valueToTree(metadata));
        try {
            return mapper.treeToValue(upcast, eventClass);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw EventSerializationException.deserializeFailed(typeName, e);
        }
    }

    /**
     * Converts snapshot state to a detached JSON tree.
     */
    public JsonNode stateToTree(Object state) {
        try {
            return mapper.valueToTree(state);
        } catch (IllegalArgumentException e) {
            throw EventSerializationException.serializeFailed(state.getClass().getName(), e);
        }
    }

    /**
     * Binds a JSON tree produced by {@link #stateToTree} to a state type.
     */
    public <S> S treeToState(JsonNode tree, Class<S> stateType) {
        try {
            return mapper.treeToValue(tree, stateType);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw EventSerializationException.deserializeFailed(stateType.getName(), e);
        }
    }

    public EventTypeRegistry getTypeRegistry() {
        return typeRegistry;
    }

    public UpcasterChain getUpcasters() {
        return upcasters;
    }
}
