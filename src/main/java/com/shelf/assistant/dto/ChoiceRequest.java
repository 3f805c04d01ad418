package com.shelf.assistant.dto;

/**
 * 手动提交的用户选择
 */
public class ChoiceRequest {
    private String itemName;
    private String itemLocation;  // 可选

    public String getItemName() { return itemName; }
    public void setItemName(String itemName) { this.itemName = itemName; }

    public String getItemLocation() { return itemLocation; }
    public void setItemLocation(String itemLocation) { this.itemLocation = itemLocation; }
}
