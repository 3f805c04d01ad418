package com.shelf.assistant.model;

import java.util.Objects;
import java.util.UUID;

/**
 * 用户通过语音对话选定的商品（后端持有，这里只读取）
 */
public final class UserChoice {
    private final UUID id;
    private final String itemName;
    private final String itemLocation;
    private final boolean processed;

    public UserChoice(UUID id, String itemName, String itemLocation, boolean processed) {
        this.id = Objects.requireNonNull(id, "id");
        this.itemName = Objects.requireNonNull(itemName, "itemName");
        this.itemLocation = itemLocation;
        this.processed = processed;
    }

    public UUID getId() { return id; }
    public String getItemName() { return itemName; }
    public String getItemLocation() { return itemLocation; }
    public boolean isProcessed() { return processed; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserChoice)) return false;
        UserChoice that = (UserChoice) o;
        return processed == that.processed && id.equals(that.id) && itemName.equals(that.itemName)
                && Objects.equals(itemLocation, that.itemLocation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, itemName, itemLocation, processed);
    }

    @Override
    public String toString() {
        return "UserChoice{id=" + id + ", itemName='" + itemName + "', itemLocation='" + itemLocation
                + "', processed=" + processed + '}';
    }
}
