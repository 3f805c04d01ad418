package com.shelf.assistant.core.vision;

import com.shelf.assistant.core.catalog.ProductRecord;

import java.util.Collections;
import java.util.List;

/**
 * 识别阶段结果：按识别顺序排列的商品草稿
 */
public class IdentificationResult extends VisionResult {
    private final List<ProductRecord> drafts;

    public IdentificationResult(List<ProductRecord> drafts, String rawText) {
        super(rawText);
        this.drafts = Collections.unmodifiableList(drafts);
    }

    @Override
    public AnalysisMode getMode() {
        return AnalysisMode.IDENTIFYING;
    }

    public List<ProductRecord> getDrafts() {
        return drafts;
    }
}
