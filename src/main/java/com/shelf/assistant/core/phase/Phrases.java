package com.shelf.assistant.core.phase;

import com.shelf.assistant.core.catalog.ProductCatalog;
import com.shelf.assistant.core.catalog.ProductRecord;

/**
 * 播报给用户的固定话术
 */
public final class Phrases {

    public static final String READY_FOR_SHELF = "View looks good. Take the shelf photo now.";
    public static final String ADJUST_CAMERA = "Move the camera so the whole shelf is in view.";
    public static final String NO_PRODUCTS = "I couldn't find any products. Let's try again, point the camera at the shelf.";
    public static final String CATALOG_REJECTED = "Sorry, I couldn't save the shelf list. Please take the shelf photo again.";
    public static final String VISION_UNAVAILABLE = "Sorry, I'm having trouble analyzing the image right now. Please take another photo.";
    public static final String PHOTO_RETRY = "Sorry, I couldn't make sense of that photo. Please take another photo.";
    public static final String HAND_NOT_VISIBLE = "I can't see your hand. Hold it in front of the camera.";
    public static final String HOLD_STEADY = "You're almost there. Hold steady.";
    public static final String STORE_UNAVAILABLE = "I can't reach the server. Please try again later.";
    public static final String SESSION_RESET = "Okay, starting over. Point the camera at the shelf.";

    private Phrases() {
    }

    public static String catalogSummary(ProductCatalog catalog) {
        StringBuilder sb = new StringBuilder("Here's what I found: ");
        for (ProductRecord product : catalog.getProducts()) {
            if (product.getItemNumber() > 1) {
                sb.append("; ");
            }
            sb.append(product.getItemNumber()).append(", ").append(product.getName());
            if (!product.getBrand().isEmpty()) {
                sb.append(" by ").append(product.getBrand());
            }
            if (product.getPrice() != null) {
                sb.append(", ").append(product.getPrice().toPlainString());
            }
        }
        return sb.append(". Which item would you like?").toString();
    }

    public static String notRecognized(String itemName) {
        return "Sorry, item not recognized: " + itemName + ". Please repeat your choice.";
    }

    public static String startGuiding(ProductRecord item) {
        String where = item.getLocation().isEmpty() ? "" : " It should be " + item.getLocation() + ".";
        return "Okay, let's find " + item.getName() + "." + where + " Raise your hand and take a photo.";
    }

    public static String itemReached(ProductRecord item) {
        return "Got it! Your hand is on " + item.getName() + ".";
    }
}
