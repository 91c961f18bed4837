package com.jreinhal.edbot.model;

/**
 * Bounding box on a rendered page, in page coordinates.
 */
public record BBox(double x0, double y0, double x1, double y1) {

    public BBox union(BBox other) {
        if (other == null) {
            return this;
        }
        return new BBox(Math.min(x0, other.x0), Math.min(y0, other.y0),
                Math.max(x1, other.x1), Math.max(y1, other.y1));
    }
}
