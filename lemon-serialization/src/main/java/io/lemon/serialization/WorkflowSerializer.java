package io.lemon.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.lemon.core.validation.ValidationSession;
import io.lemon.core.workflow.Workflow;

/// JSON entry points for Lemon's two document kinds.
///
/// A workflow document is the full definition: id, metadata, blocks tagged
/// with their `type`, and connections. It reads back into a {@link Workflow}
/// with every builder check applied, so a document with a dangling connection
/// or a decision missing its condition is rejected rather than loaded.
///
/// A validation record is the read-only export of a session: its id, workflow,
/// status, progress, score with confidence band, and each recorded answer.
/// Records are never read back.
///
/// {@snippet :
/// Files.writeString(path, WorkflowSerializer.toJson(workflow));
/// Workflow loaded = WorkflowSerializer.fromJson(Files.readString(path));
///
/// String record = WorkflowSerializer.toJson(manager.getSession(sessionId));
/// }
///
/// @implNote Each call builds its own mapper. {@link FileWorkflowRepository}
/// holds one from {@link #createMapper()} instead.
///
/// @see LemonJacksonModule
public final class WorkflowSerializer {

    private WorkflowSerializer() {}

    /// Writes a workflow document.
    ///
    /// @param workflow the workflow, not null
    /// @return indented JSON, never null
    /// @throws IllegalArgumentException if the workflow cannot be written
    public static String toJson(Workflow workflow) {
        return write(workflow, "workflow");
    }

    /// Reads a workflow document.
    ///
    /// Unknown fields are skipped; structural problems surface as the
    /// builder's own messages.
    ///
    /// @param json the document, not null
    /// @return the workflow, never null
    /// @throws IllegalArgumentException if the JSON is malformed or the
    ///         workflow it describes is invalid
    public static Workflow fromJson(String json) {
        try {
            return createMapper().readValue(json, Workflow.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize workflow: " + e.getMessage(), e);
        }
    }

    /// Writes a validation record for a session.
    ///
    /// @param session the session, not null
    /// @return indented JSON, never null
    /// @throws IllegalArgumentException if the record cannot be written
    public static String toJson(ValidationSession session) {
        return write(session, "validation session");
    }

    /// Builds the mapper shared by workflow documents and validation records.
    ///
    /// Block types, connections and metadata come from {@link LemonJacksonModule}.
    /// Timestamps are ISO-8601 strings and output is indented for hand editing.
    /// Fields this version does not know are ignored, so documents written by
    /// newer releases still load.
    ///
    /// @return a new mapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new LemonJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static String write(Object document, String kind) {
        try {
            return createMapper().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + kind + ": " + e.getMessage(), e);
        }
    }
}
