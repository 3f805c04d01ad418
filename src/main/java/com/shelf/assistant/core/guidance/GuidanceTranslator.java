package com.shelf.assistant.core.guidance;

/**
 * 把角度偏移转换成钟点方向的语音提示
 * <p>
 * 每个钟点占 30°，四舍五入，恰好在中间时取顺时针方向的钟点。
 * 0° 和 360° 都是 12 点，90° 是 3 点。
 */
public class GuidanceTranslator {

    private static final double DEGREES_PER_HOUR = 30.0;

    public int clockPosition(double angleDegrees) {
        double normalized = normalize(angleDegrees);
        int hour = (int) Math.floor(normalized / DEGREES_PER_HOUR + 0.5);
        return hour == 0 || hour == 12 ? 12 : hour;
    }

    public String translate(Offset offset) {
        return "Move your hand toward " + clockPosition(offset.getAngleDegrees()) + " o'clock, "
                + offset.getDistanceHint().getQualifier() + ".";
    }

    /**
     * 手是否已到达目标：距离为 NEAR 且角度偏离 12 点不超过容差
     */
    public boolean isReached(Offset offset, double toleranceDegrees) {
        if (offset.getDistanceHint() != DistanceHint.NEAR) {
            return false;
        }
        double normalized = normalize(offset.getAngleDegrees());
        double deviation = Math.min(normalized, 360.0 - normalized);
        return deviation <= toleranceDegrees;
    }

    private static double normalize(double angleDegrees) {
        double normalized = angleDegrees % 360.0;
        if (normalized < 0) {
            normalized += 360.0;
        }
        return normalized;
    }
}
