package com.shelf.assistant.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 记录 API 请求与响应
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_BODY_LOG = 1000;
    private static final String STATUS_PATH = "/api/assistant/status";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return !path.startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String path = request.getRequestURI();

        // 照片上传和语音文件不缓存内容
        if (path.startsWith("/api/photos/upload") || path.startsWith("/api/speech/")) {
            long startTime = System.currentTimeMillis();
            try {
                filterChain.doFilter(request, response);
            } finally {
                logSummary(request, response.getStatus(), System.currentTimeMillis() - startTime);
            }
            return;
        }

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        long startTime = System.currentTimeMillis();
        try {
            filterChain.doFilter(requestWrapper, responseWrapper);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            logSummary(request, responseWrapper.getStatus(), duration);

            byte[] content = requestWrapper.getContentAsByteArray();
            if (content.length > 0) {
                logger.info("Request Body: {}", abbreviate(new String(content, StandardCharsets.UTF_8)));
            }

            byte[] responseContent = responseWrapper.getContentAsByteArray();
            String contentType = responseWrapper.getContentType();
            if (responseContent.length > 0 && contentType != null && contentType.contains("json")) {
                logger.debug("Response Body: {}", abbreviate(new String(responseContent, StandardCharsets.UTF_8)));
            }

            // 复制响应到原始响应，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();
        }
    }

    /**
     * 状态查询由手机端轮询，只在 DEBUG 级别记录
     */
    private static void logSummary(HttpServletRequest request, int status, long durationMs) {
        String path = request.getRequestURI();
        if (STATUS_PATH.equals(path) && status < 400) {
            logger.debug("{} {} | {} ms | Status: {}", request.getMethod(), path, durationMs, status);
        } else {
            logger.info("{} {} | {} ms | Status: {}", request.getMethod(), path, durationMs, status);
        }
    }

    private static String abbreviate(String body) {
        return body.length() > MAX_BODY_LOG ? body.substring(0, MAX_BODY_LOG) + "..." : body;
    }
}
