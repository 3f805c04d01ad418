package com.shelf.assistant.core.vision;

import com.shelf.assistant.core.guidance.Offset;

/**
 * 引导阶段结果：目标商品相对手的偏移
 */
public class GuidanceResult extends VisionResult {
    private final Offset offset;
    private final boolean handVisible;
    private final String instruction;

    public GuidanceResult(Offset offset, boolean handVisible, String instruction, String rawText) {
        super(rawText);
        this.offset = offset;
        this.handVisible = handVisible;
        this.instruction = instruction;
    }

    @Override
    public AnalysisMode getMode() {
        return AnalysisMode.GUIDING;
    }

    public Offset getOffset() { return offset; }
    public boolean isHandVisible() { return handVisible; }
    public String getInstruction() { return instruction; }
}
