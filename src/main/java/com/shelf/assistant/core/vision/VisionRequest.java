package com.shelf.assistant.core.vision;

import com.shelf.assistant.core.catalog.ProductRecord;

import java.util.Objects;

public final class VisionRequest {
    private final byte[] image;
    private final String mimeType;
    private final AnalysisMode mode;
    private final ProductRecord target;

    private VisionRequest(byte[] image, String mimeType, AnalysisMode mode, ProductRecord target) {
        this.image = Objects.requireNonNull(image, "image");
        this.mimeType = mimeType == null ? "image/jpeg" : mimeType;
        this.mode = Objects.requireNonNull(mode, "mode");
        this.target = target;
    }

    public static VisionRequest positioning(byte[] image, String mimeType) {
        return new VisionRequest(image, mimeType, AnalysisMode.POSITIONING, null);
    }

    public static VisionRequest identifying(byte[] image, String mimeType) {
        return new VisionRequest(image, mimeType, AnalysisMode.IDENTIFYING, null);
    }

    public static VisionRequest guiding(byte[] image, String mimeType, ProductRecord target) {
        return new VisionRequest(image, mimeType, AnalysisMode.GUIDING,
                Objects.requireNonNull(target, "Guiding requires a target product"));
    }

    public byte[] getImage() { return image; }
    public String getMimeType() { return mimeType; }
    public AnalysisMode getMode() { return mode; }
    public ProductRecord getTarget() { return target; }
}
