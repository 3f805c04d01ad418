package com.shelf.assistant.core.guidance;

import java.util.Objects;

/**
 * 目标商品相对手的位置
 * <p>
 * angleDegrees 以 12 点方向为 0°，顺时针增加；手已在商品上时为 0°。
 */
public final class Offset {
    private final double angleDegrees;
    private final DistanceHint distanceHint;

    public Offset(double angleDegrees, DistanceHint distanceHint) {
        if (Double.isNaN(angleDegrees) || Double.isInfinite(angleDegrees)) {
            throw new IllegalArgumentException("Angle must be finite, got " + angleDegrees);
        }
        this.angleDegrees = angleDegrees;
        this.distanceHint = Objects.requireNonNull(distanceHint, "distanceHint");
    }

    public double getAngleDegrees() { return angleDegrees; }
    public DistanceHint getDistanceHint() { return distanceHint; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Offset)) return false;
        Offset offset = (Offset) o;
        return Double.compare(offset.angleDegrees, angleDegrees) == 0 && distanceHint == offset.distanceHint;
    }

    @Override
    public int hashCode() {
        return Objects.hash(angleDegrees, distanceHint);
    }

    @Override
    public String toString() {
        return "Offset{angle=" + angleDegrees + "°, distance=" + distanceHint + '}';
    }
}
