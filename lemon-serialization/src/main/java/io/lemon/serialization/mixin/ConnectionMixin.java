package io.lemon.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin for the `Connection` record: fixes the field order so stored
/// documents diff cleanly.
@JsonPropertyOrder({"id", "fromBlock", "fromPort", "toBlock", "toPort"})
public abstract class ConnectionMixin {}
