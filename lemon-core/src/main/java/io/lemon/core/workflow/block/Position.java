package io.lemon.core.workflow.block;

/// Editor canvas coordinates of a block. Carries no execution semantics.
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);
}
