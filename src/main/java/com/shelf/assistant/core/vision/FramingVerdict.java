package com.shelf.assistant.core.vision;

/**
 * 定位阶段结果：货架是否完整入镜
 */
public class FramingVerdict extends VisionResult {
    private final boolean framed;
    private final double confidence;
    private final String instruction;

    public FramingVerdict(boolean framed, double confidence, String instruction, String rawText) {
        super(rawText);
        this.framed = framed;
        this.confidence = confidence;
        this.instruction = instruction;
    }

    @Override
    public AnalysisMode getMode() {
        return AnalysisMode.POSITIONING;
    }

    public boolean isFramed() { return framed; }
    public double getConfidence() { return confidence; }
    public String getInstruction() { return instruction; }

    /**
     * 模型认为已入镜且置信度达到阈值
     */
    public boolean isFramed(double confidenceThreshold) {
        return framed && confidence >= confidenceThreshold;
    }

    @Override
    public String toString() {
        return "FramingVerdict{framed=" + framed + ", confidence=" + confidence + ", instruction='" + instruction + "'}";
    }
}
