package com.shelf.assistant.core.vision;

/**
 * 视觉分析模式，对应状态机中需要看图的三个阶段
 */
public enum AnalysisMode {
    /** 货架是否完整入镜 */
    POSITIONING,
    /** 列出所有商品 */
    IDENTIFYING,
    /** 手相对目标商品的位置 */
    GUIDING
}
