package com.shelf.assistant.core.vision;

/**
 * 视觉分析结果，按分析模式区分具体类型
 *
 * @see FramingVerdict
 * @see IdentificationResult
 * @see GuidanceResult
 */
public abstract class VisionResult {
    private final String rawText;

    protected VisionResult(String rawText) {
        this.rawText = rawText;
    }

    public abstract AnalysisMode getMode();

    /**
     * 模型原始输出，便于日志排查
     */
    public String getRawText() {
        return rawText;
    }
}
