package com.shelf.assistant.core.photo;

/**
 * 文件名中的拍摄意图标记
 */
public enum CaptureFlag {
    /** _low: 定位 / 手部引导 */
    POSITIONING("low"),
    /** _high: 商品识别 */
    IDENTIFICATION("high");

    private final String marker;

    CaptureFlag(String marker) {
        this.marker = marker;
    }

    public String getMarker() {
        return marker;
    }

    public static CaptureFlag fromMarker(String marker) {
        for (CaptureFlag flag : values()) {
            if (flag.marker.equalsIgnoreCase(marker)) {
                return flag;
            }
        }
        return null;
    }
}
