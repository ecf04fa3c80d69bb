package io.lemon.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.lemon.core.validation.SessionProgress;
import io.lemon.core.validation.ValidationAnswer;
import io.lemon.core.validation.ValidationScore;
import io.lemon.core.validation.ValidationSession;
import java.io.IOException;
import java.io.Serial;
import java.util.List;

/// Writes a validation session as a flat record for export and audit.
///
/// ```
/// {
///   "id": "3f9c01a2b7de",
///   "workflow_id": "age-check",
///   "status": "COMPLETED",
///   "progress": {"current": 2, "total": 2, "remaining": 0},
///   "created_at": "2024-05-01T10:15:30Z",
///   "score": {"matches": 2, "total": 2, "score": 100.0, "confidence": "LOW"},
///   "answers": [{"case_id": "...", "user_answer": "adult",
///                "workflow_output": "adult", "matched": true, "timestamp": "..."}]
/// }
/// ```
///
/// Cases are not written; only the answers given for them. Write-only: a
/// session is live state owned by the session manager and is never restored
/// from a record.
///
/// @implNote Package-private. Registered by {@link LemonJacksonModule}. The
/// session's own monitor guards each getter, so a record taken while answers
/// are being submitted is consistent per field, not across fields.
class ValidationRecordSerializer extends StdSerializer<ValidationSession> {

    @Serial private static final long serialVersionUID = 8843601924237145519L;

    ValidationRecordSerializer() {
        super(ValidationSession.class);
    }

    @Override
    public void serialize(ValidationSession session, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", session.getId());
        gen.writeStringField("workflow_id", session.getWorkflowId());
        gen.writeStringField("status", session.getStatus().name());

        SessionProgress progress = session.getProgress();
        gen.writeObjectFieldStart("progress");
        gen.writeNumberField("current", progress.current());
        gen.writeNumberField("total", progress.total());
        gen.writeNumberField("remaining", progress.remaining());
        gen.writeEndObject();

        provider.defaultSerializeField("created_at", session.getCreatedAt(), gen);

        ValidationScore score = session.getScore();
        gen.writeObjectFieldStart("score");
        gen.writeNumberField("matches", score.matches());
        gen.writeNumberField("total", score.total());
        gen.writeNumberField("score", score.score());
        gen.writeStringField("confidence", score.confidence().name());
        gen.writeEndObject();

        writeAnswers(session.getAnswers(), gen, provider);
        gen.writeEndObject();
    }

    private void writeAnswers(
            List<ValidationAnswer> answers, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeArrayFieldStart("answers");
        for (ValidationAnswer answer : answers) {
            gen.writeStartObject();
            gen.writeStringField("case_id", answer.caseId());
            gen.writeStringField("user_answer", answer.userAnswer());
            gen.writeStringField("workflow_output", answer.workflowOutput());
            gen.writeBooleanField("matched", answer.matched());
            provider.defaultSerializeField("timestamp", answer.timestamp(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();
    }
}
