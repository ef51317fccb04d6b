package com.dealereye.analytics.layout;

import java.util.List;

/**
 * Crossing line on one camera.
 *
 * @param lineId unique identifier, referenced by line crossing primitives
 * @param cameraId camera the line is drawn on
 * @param name display name
 * @param lineType semantic role
 * @param points exactly two end points
 * @param direction label of the forward crossing direction, if any
 */
public record Line(
        String lineId,
        String cameraId,
        String name,
        LineType lineType,
        List<Point> points,
        String direction) {

    public Line {
        if (lineId == null || lineId.isBlank()) {
            throw new IllegalArgumentException("lineId must not be null or blank");
        }
        if (lineType == null) {
            throw new IllegalArgumentException("lineType must not be null for line " + lineId);
        }
        if (points == null || points.size() != 2) {
            throw new IllegalArgumentException("Line " + lineId + " must have exactly 2 points");
        }
        points = List.copyOf(points);
    }
}
