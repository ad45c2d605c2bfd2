package com.bookforge.ocr.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A labeled region reported by the layout-detection plugin for one page.
 */
public final class LayoutRegion {
    public final LayoutLabel label;
    public final BoundingBox box;
    public final double confidence;
    public final List<double[]> polygon;
    public final int position;

    public LayoutRegion(LayoutLabel label, BoundingBox box, double confidence, List<double[]> polygon, int position) {
        this.label = Objects.requireNonNull(label, "label");
        this.box = Objects.requireNonNull(box, "box");
        this.confidence = confidence;
        List<double[]> points = new ArrayList<>();
        if (polygon != null) {
            for (double[] point : polygon) {
                points.add(point.clone());
            }
        }
        this.polygon = Collections.unmodifiableList(points);
        this.position = position;
    }

    public LayoutRegion(LayoutLabel label, BoundingBox box) {
        this(label, box, 1.0, null, 0);
    }

    @Override
    public String toString() {
        return "LayoutRegion{" + label + ", box=" + box + ", confidence=" + confidence + "}";
    }
}
