package com.example.ringside.model;

/**
 * Ring position in feet from the centre.
 */
public record Position(double x, double y) {

    public static final Position CENTER = new Position(0, 0);

    public double distanceTo(Position other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
