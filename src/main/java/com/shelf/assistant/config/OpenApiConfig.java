package com.shelf.assistant.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.Set;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    private static final Set<String> BACKEND_PATHS = Set.of("/api/assistant/choice", "/api/catalogs/latest");

    @Bean
    public OpenAPI shelfAssistantOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Shelf Assistant API")
                        .description("""
                                货架购物助手 API 文档

                                ## 功能概述

                                穿戴式摄像头拍摄货架照片，系统识别商品、等待用户语音选择，再用钟点方向引导用户的手拿到商品。

                                ### 会话阶段
                                | 阶段 | 说明 |
                                |------|------|
                                | `POSITIONING` | 调整摄像头直到整个货架入镜（_low 照片） |
                                | `IDENTIFYING` | 拍摄高清货架照片（_high 照片），生成商品清单 |
                                | `AWAITING_SELECTION` | 清单已上传，轮询后端等待用户选择 |
                                | `GUIDING` | 根据手部照片（_low）播报方向提示 |
                                | `COMPLETED` | 手已到达商品，确认选择后回到 `POSITIONING` |

                                ### 照片命名
                                `<前缀>_<ISO8601 时间戳，':' 换成 '-'>_<low|high>.<jpg|jpeg|png>`，
                                例如 `photo_2025-01-18T14-30-00Z_low.jpg`。手机端也可以通过 `/api/photos/upload` 上传。

                                ### 响应格式
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0"));
    }

    /**
     * 统一响应信封；访问后端的接口额外标注 502 / 503
     */
    @Bean
    public OpenApiCustomizer envelopeResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            boolean callsBackend = BACKEND_PATHS.contains(path);
            for (Operation operation : pathItem.readOperations()) {
                ApiResponses responses = operation.getResponses();
                responses.addApiResponse("200", envelope("成功", "success", "data",
                        new Schema<>().type("object").description("响应数据")));
                if (pathItem.getPost() == operation) {
                    responses.addApiResponse("400", errorEnvelope("请求参数错误", "flag must be 'low' or 'high'"));
                }
                if (callsBackend) {
                    responses.addApiResponse("502", errorEnvelope("后端拒绝了请求或返回了无法解析的数据",
                            "Backend poll choice failed with HTTP 422"));
                    responses.addApiResponse("503", errorEnvelope("后端暂时不可用",
                            "Backend unreachable (submit choice): Connection refused"));
                }
            }
        });
    }

    private static ApiResponse errorEnvelope(String description, String example) {
        return envelope(description, "error", "message", new Schema<>().type("string").example(example));
    }

    private static ApiResponse envelope(String description, String status, String field, Schema<?> payload) {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").example(status),
                field, payload
        ));
        return new ApiResponse()
                .description(description)
                .content(new Content().addMediaType("application/json", new MediaType().schema(schema)));
    }
}
