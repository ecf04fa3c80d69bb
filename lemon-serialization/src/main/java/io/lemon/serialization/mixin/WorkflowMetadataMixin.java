package io.lemon.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/// Jackson mixin for the `WorkflowMetadata` record.
///
/// Confidence and the validated flag are derived from the score and count, so
/// they are neither written nor read. Unset optional fields (`domain`,
/// `creatorId`) are omitted.
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties({"validated", "confidence"})
public abstract class WorkflowMetadataMixin {}
