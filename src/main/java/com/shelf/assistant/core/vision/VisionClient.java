package com.shelf.assistant.core.vision;

/**
 * 视觉分析能力，与具体模型提供方无关
 */
public interface VisionClient {

    /**
     * 分析一张照片
     *
     * @param request 照片、分析模式及目标商品（引导模式）
     * @return 与模式对应的结果类型
     * @throws VisionUnavailableException 超时或传输失败，由调用方决定是否重试
     * @throws VisionParseException       模型输出格式不正确，不应重试
     */
    VisionResult analyze(VisionRequest request) throws VisionException;
}
