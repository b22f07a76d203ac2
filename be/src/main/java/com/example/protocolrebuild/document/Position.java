package com.example.protocolrebuild.document;

import java.util.Comparator;

/**
 * Layout hint for a node. Never semantically meaningful.
 */
public record Position(double x, double y) {

    public static final Position ORIGIN = new Position(0, 0);

    /** Top-to-bottom, then left-to-right: the reading order of a laid-out flow. */
    public static final Comparator<Position> LAYOUT_ORDER =
            Comparator.comparingDouble(Position::y).thenComparingDouble(Position::x);
}
