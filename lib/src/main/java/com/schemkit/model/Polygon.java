package com.schemkit.model;

import com.schemkit.spatial.BoundingBox;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Polygon extends Shape {

    /** One polygon vertex. */
    public record Point(double x, double y) {}

    private final List<Point> points = new ArrayList<>();
    private int fill;

    public Polygon() {}

    public Polygon(List<Point> points) {
        this.points.addAll(points);
    }

    public void addPoint(double x, double y) {
        points.add(new Point(x, y));
    }

    public List<Point> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public int getPointCount() {
        return points.size();
    }

    public int getFill() {
        return fill;
    }

    public void setFill(int fill) {
        this.fill = fill;
    }

    @Override
    public BoundingBox getBoundingBox() {
        if (points.isEmpty()) {
            return BoundingBox.EMPTY;
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Point point : points) {
            minX = Math.min(minX, point.x());
            minY = Math.min(minY, point.y());
            maxX = Math.max(maxX, point.x());
            maxY = Math.max(maxY, point.y());
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }
}
