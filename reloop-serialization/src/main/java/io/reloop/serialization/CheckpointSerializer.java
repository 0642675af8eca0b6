package io.reloop.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.reloop.core.checkpoint.Checkpoint;
import io.reloop.core.iteration.IterationVerdict;

/// JSON form of the records a checkpoint store persists.
///
/// A {@link Checkpoint} is stored whole, config and rules included, so a session
/// resumes from one document. The {@link IterationVerdict} of the newest
/// checkpoint is stored next to its chain header. Both use the same mapper as
/// the REST layer, so a rule reads the same in a request body, a checkpoint
/// payload and a verdict.
///
/// {@snippet :
/// String payload = CheckpointSerializer.toJson(checkpoint);
/// Checkpoint resumed = CheckpointSerializer.fromJson(payload);
/// }
///
/// Unknown properties are ignored, so payloads written by a newer release still
/// load. Instants are written as ISO-8601 strings.
///
/// @implNote Thread-safe. The static helpers share one configured mapper;
/// {@link #createMapper()} returns a fresh one for callers that add modules.
///
/// @see ReloopJacksonModule
public final class CheckpointSerializer {

    private static final ObjectMapper SHARED = createMapper();

    private CheckpointSerializer() {}

    /// Writes a checkpoint as indented JSON.
    ///
    /// @param checkpoint the checkpoint, not null
    /// @return the JSON document, never null
    /// @throws IllegalArgumentException if the checkpoint cannot be written
    public static String toJson(Checkpoint checkpoint) {
        return write(checkpoint, "checkpoint");
    }

    /// Reads a checkpoint written by {@link #toJson(Checkpoint)}.
    ///
    /// @param json the JSON document, not null
    /// @return the checkpoint, never null
    /// @throws IllegalArgumentException if the document is not a checkpoint
    public static Checkpoint fromJson(String json) {
        return read(json, Checkpoint.class, "checkpoint");
    }

    /// Writes a verdict, with its report and any escalation or stop hook result.
    ///
    /// @param verdict the verdict, not null
    /// @return the JSON document, never null
    /// @throws IllegalArgumentException if the verdict cannot be written
    public static String verdictToJson(IterationVerdict verdict) {
        return write(verdict, "verdict");
    }

    /// Reads a verdict written by {@link #verdictToJson(IterationVerdict)}.
    ///
    /// @param json the JSON document, not null
    /// @return the verdict, never null
    /// @throws IllegalArgumentException if the document is not a verdict
    public static IterationVerdict verdictFromJson(String json) {
        return read(json, IterationVerdict.class, "verdict");
    }

    /// Creates a mapper that understands every Reloop type.
    ///
    /// | Setting | Value |
    /// |---------|-------|
    /// | modules | {@link ReloopJacksonModule}, `JavaTimeModule` |
    /// | unknown properties | ignored |
    /// | instants | ISO-8601 strings |
    /// | output | indented |
    ///
    /// @return a new mapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new ReloopJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static String write(Object value, String what) {
        try {
            return SHARED.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getOriginalMessage(), e);
        }
    }

    private static <T> T read(String json, Class<T> type, String what) {
        try {
            return SHARED.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize " + what + ": " + e.getOriginalMessage(), e);
        }
    }
}
