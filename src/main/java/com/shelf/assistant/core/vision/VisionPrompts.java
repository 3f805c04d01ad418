package com.shelf.assistant.core.vision;

import com.shelf.assistant.core.catalog.ProductRecord;

/**
 * 各分析模式的提示词
 */
public final class VisionPrompts {

    private VisionPrompts() {
    }

    static final String POSITIONING = """
            You are a navigation assistant helping a visually impaired user position their camera to see a store shelf.

            Decide whether ALL products of the shelf section are visible in the frame.
            Check whether products are cut off at the left, right, top or bottom edge.

            Respond with ONLY a JSON object, no markdown:
            {"framed": true|false, "confidence": 0.0-1.0, "instruction": "<one short spoken instruction>"}

            - "framed" is true only when the full shelf section is visible
            - "instruction" is one clear, short adjustment when not framed: "Move left", "Move right",
              "Tilt up", "Tilt down", "Step back" or "Step forward", optionally with a clock position
            - when framed, "instruction" is a short description of what is visible
            """;

    static final String IDENTIFYING = """
            You are an item identification assistant for visually impaired users.

            You are looking at a store shelf. Identify ALL products visible and output them as CSV data.

            OUTPUT FORMAT - output ONLY a valid CSV with these exact columns:
            item_number,product_name,brand,location,price

            Rules:
            - First line must be the header: item_number,product_name,brand,location,price
            - List EVERY distinct product you can see
            - item_number: sequential number starting from 1
            - product_name: the product type/name (e.g., "Cola 330ml", "Sparkling Water 500ml")
            - brand: the brand name if visible, otherwise "Unknown"
            - location: describe using "top/middle/bottom shelf" and "left/center/right"
            - price: the price if visible, otherwise "N/A"
            - quote any field that contains a comma
            - Do NOT include any text before or after the CSV
            - Do NOT use markdown code blocks
            - If no products are visible, output only the header line
            """;

    static final String GUIDING = """
            You are a hand-guidance assistant helping a visually impaired user reach for a specific item on a shelf.

            The user wants to find: %s
            Its known location is: %s

            Look at the user's hand and the target item and report where the item is relative to the hand.

            Respond with ONLY a JSON object, no markdown:
            {"hand_visible": true|false, "angle_degrees": 0-360, "distance": "near"|"far", "instruction": "<short spoken hint>"}

            - angle_degrees is the direction from the hand to the item: 0 = straight up (12 o'clock),
              90 = right (3 o'clock), 180 = down (6 o'clock), 270 = left (9 o'clock)
            - distance is "near" when the hand is within about 10 centimeters of the item, otherwise "far"
            - when the hand is touching or directly on the item, use angle_degrees 0 and distance "near"
            - if the hand is not visible set hand_visible to false and tell the user to bring the hand into view
            """;

    public static String promptFor(VisionRequest request) {
        switch (request.getMode()) {
            case POSITIONING:
                return POSITIONING;
            case IDENTIFYING:
                return IDENTIFYING;
            case GUIDING:
                ProductRecord target = request.getTarget();
                String location = target.getLocation().isEmpty() ? "unknown" : target.getLocation();
                return String.format(GUIDING, target.getName(), location);
            default:
                throw new IllegalArgumentException("Unsupported analysis mode: " + request.getMode());
        }
    }

    public static String userMessageFor(VisionRequest request) {
        switch (request.getMode()) {
            case POSITIONING:
                return "Analyze this camera view and guide me to position it.";
            case IDENTIFYING:
                return "Identify all products on this shelf and output as CSV.";
            case GUIDING:
                return "Guide my hand to reach " + request.getTarget().getName() + ".";
            default:
                throw new IllegalArgumentException("Unsupported analysis mode: " + request.getMode());
        }
    }
}
