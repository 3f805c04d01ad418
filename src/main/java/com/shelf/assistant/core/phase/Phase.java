package com.shelf.assistant.core.phase;

/**
 * 会话阶段
 */
public enum Phase {
    /** 调整摄像头，直到整个货架入镜 */
    POSITIONING,
    /** 等待高清货架照片 */
    IDENTIFYING,
    /** 商品清单已生成，等待用户选择 */
    AWAITING_SELECTION,
    /** 引导用户的手移向目标商品 */
    GUIDING,
    /** 已拿到商品，随即回到 POSITIONING */
    COMPLETED
}
