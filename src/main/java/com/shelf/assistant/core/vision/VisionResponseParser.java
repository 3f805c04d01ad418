package com.shelf.assistant.core.vision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelf.assistant.core.catalog.CatalogFormatException;
import com.shelf.assistant.core.catalog.ProductCatalogCodec;
import com.shelf.assistant.core.catalog.ProductRecord;
import com.shelf.assistant.core.guidance.DistanceHint;
import com.shelf.assistant.core.guidance.Offset;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 把模型文本输出解析为分阶段的结果类型
 * <ul>
 *   <li>POSITIONING / GUIDING: JSON 对象（容忍 markdown 代码块和前后多余文字）</li>
 *   <li>IDENTIFYING: CSV，商品按出现顺序重新编号</li>
 * </ul>
 */
public class VisionResponseParser {

    private final ObjectMapper objectMapper;
    private final ProductCatalogCodec codec;

    public VisionResponseParser(ObjectMapper objectMapper, ProductCatalogCodec codec) {
        this.objectMapper = objectMapper;
        this.codec = codec;
    }

    public VisionResult parse(AnalysisMode mode, String text) throws VisionParseException {
        if (text == null || text.isBlank()) {
            throw new VisionParseException("Model returned an empty response for " + mode);
        }
        switch (mode) {
            case POSITIONING:
                return parseFraming(text);
            case IDENTIFYING:
                return parseIdentification(text);
            case GUIDING:
                return parseGuidance(text);
            default:
                throw new VisionParseException("Unsupported analysis mode: " + mode);
        }
    }

    FramingVerdict parseFraming(String text) throws VisionParseException {
        JsonNode node = readJsonObject(text);
        JsonNode framed = node.get("framed");
        if (framed == null || !framed.isBoolean()) {
            throw new VisionParseException("Positioning response has no boolean 'framed': " + abbreviate(text));
        }
        double confidence = node.has("confidence") && node.get("confidence").isNumber()
                ? node.get("confidence").asDouble()
                : (framed.asBoolean() ? 1.0 : 0.0);
        return new FramingVerdict(framed.asBoolean(), confidence, textField(node, "instruction"), text);
    }

    IdentificationResult parseIdentification(String text) throws VisionParseException {
        String csv = stripCodeFence(text);
        try {
            List<List<String>> rows = codec.parseRows(csv);
            if (rows.isEmpty()) {
                throw new VisionParseException("Identification response has no CSV header");
            }
            Map<String, Integer> header = codec.indexHeader(rows.get(0));
            List<ProductRecord> drafts = new ArrayList<>();
            for (int r = 1; r < rows.size(); r++) {
                List<String> row = rows.get(r);
                if (row.size() < rows.get(0).size()) {
                    throw new VisionParseException("Identification row " + r + " is incomplete: " + row);
                }
                String name = row.get(header.get(ProductCatalogCodec.COL_PRODUCT_NAME));
                if (name.isBlank()) {
                    continue;
                }
                drafts.add(new ProductRecord(
                        drafts.size() + 1,
                        name,
                        row.get(header.get(ProductCatalogCodec.COL_BRAND)),
                        row.get(header.get(ProductCatalogCodec.COL_LOCATION)),
                        codec.parsePrice(row.get(header.get(ProductCatalogCodec.COL_PRICE)), r)));
            }
            return new IdentificationResult(drafts, text);
        } catch (CatalogFormatException e) {
            throw new VisionParseException("Identification response is not a valid catalog: " + e.getMessage(), e);
        }
    }

    GuidanceResult parseGuidance(String text) throws VisionParseException {
        JsonNode node = readJsonObject(text);
        boolean handVisible = !node.has("hand_visible") || node.get("hand_visible").asBoolean(true);
        String instruction = textField(node, "instruction");
        if (!handVisible) {
            return new GuidanceResult(null, false, instruction, text);
        }

        Double angle = null;
        if (node.has("angle_degrees") && node.get("angle_degrees").isNumber()) {
            angle = node.get("angle_degrees").asDouble();
        } else if (node.has("clock_position") && node.get("clock_position").isNumber()) {
            angle = (node.get("clock_position").asInt() % 12) * 30.0;
        }
        if (angle == null) {
            throw new VisionParseException("Guidance response has no angle: " + abbreviate(text));
        }
        try {
            DistanceHint distance = DistanceHint.parse(textField(node, "distance"));
            return new GuidanceResult(new Offset(angle, distance), true, instruction, text);
        } catch (IllegalArgumentException e) {
            throw new VisionParseException("Guidance response is invalid: " + e.getMessage(), e);
        }
    }

    private JsonNode readJsonObject(String text) throws VisionParseException {
        String body = stripCodeFence(text);
        int start = body.indexOf('{');
        int end = body.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new VisionParseException("Response contains no JSON object: " + abbreviate(text));
        }
        try {
            JsonNode node = objectMapper.readTree(body.substring(start, end + 1));
            if (node == null || !node.isObject()) {
                throw new VisionParseException("Response is not a JSON object: " + abbreviate(text));
            }
            return node;
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new VisionParseException("Response is not valid JSON: " + abbreviate(text), e);
        }
    }

    /**
     * 去掉 ```csv ... ``` 之类的 markdown 代码块
     */
    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        String[] lines = trimmed.split("\\r?\\n");
        int from = 1;
        int to = lines.length;
        if (to > from && lines[to - 1].trim().startsWith("```")) {
            to--;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            sb.append(lines[i]).append('\n');
        }
        return sb.toString().trim();
    }

    private static String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String abbreviate(String text) {
        String oneLine = text.replaceAll("\\s+", " ").trim();
        return oneLine.length() > 200 ? oneLine.substring(0, 200) + "..." : oneLine;
    }
}
