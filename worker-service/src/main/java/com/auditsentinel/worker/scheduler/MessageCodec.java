package com.auditsentinel.worker.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

/**
 * JSON codec for the frames exchanged between the scheduler and its units.
 *
 * <p>
 * Units and the scheduler only ever exchange encoded frames, never object
 * references, so a unit cannot observe or mutate scheduler state and a
 * task result reaches the scheduler as a detached copy.
 * </p>
 *
 * <p>
 * Dates are written as ISO-8601 strings. Unknown properties are ignored on
 * read. Instances are thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class MessageCodec {

    private final ObjectMapper mapper;

    public MessageCodec() {
        this(newObjectMapper());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * @return a mapper configured the way every JSON surface of the service
     *         expects
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    // ---------------------------------------------------------------
    // Scheduler -> unit
    // ---------------------------------------------------------------

    public String encodeTask(Task task) throws JsonProcessingException {
        return mapper.writeValueAsString(new ProcessTaskMessage(task));
    }

    /**
     * @param frame encoded {@code process_task} frame
     * @return the task it carries
     * @throws JsonProcessingException if the frame is malformed or of another type
     */
    public Task decodeTask(String frame) throws JsonProcessingException {
        JsonNode node = mapper.readTree(frame);
        String type = node.path("type").asText();
        if (!ProcessTaskMessage.TYPE.equals(type)) {
            throw new UnexpectedFrameException("Expected a " + ProcessTaskMessage.TYPE + " frame, got: " + type);
        }
        return mapper.treeToValue(node, ProcessTaskMessage.class).getTask();
    }

    // ---------------------------------------------------------------
    // Unit -> scheduler
    // ---------------------------------------------------------------

    public String encodeMessage(WorkerMessage message) throws JsonProcessingException {
        return mapper.writeValueAsString(message);
    }

    public WorkerMessage decodeMessage(String frame) throws JsonProcessingException {
        return mapper.readValue(frame, WorkerMessage.class);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    /**
     * A well-formed frame of the wrong type.
     */
    public static class UnexpectedFrameException extends JsonProcessingException {

        private static final long serialVersionUID = 1L;

        public UnexpectedFrameException(String message) {
            super(message);
        }
    }
}
