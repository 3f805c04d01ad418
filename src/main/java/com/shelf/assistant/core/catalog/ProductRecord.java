package com.shelf.assistant.core.catalog;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * 货架上的一件商品
 * <p>
 * price 为 null 表示价签不可见（CSV 中写作 N/A）
 */
public final class ProductRecord {
    private final int itemNumber;
    private final String name;
    private final String brand;
    private final String location;
    private final BigDecimal price;

    public ProductRecord(int itemNumber, String name, String brand, String location, BigDecimal price) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Product name must not be blank (item " + itemNumber + ")");
        }
        this.itemNumber = itemNumber;
        this.name = name.trim();
        this.brand = brand == null ? "" : brand.trim();
        this.location = location == null ? "" : location.trim();
        this.price = price;
    }

    /**
     * 重新编号（识别结果按顺序编号 1..n）
     */
    public ProductRecord withItemNumber(int newItemNumber) {
        return new ProductRecord(newItemNumber, name, brand, location, price);
    }

    /**
     * 用户选择与商品名的匹配：去空格、忽略大小写
     */
    public boolean matchesName(String candidate) {
        if (candidate == null) {
            return false;
        }
        return name.toLowerCase(Locale.ROOT).equals(candidate.trim().toLowerCase(Locale.ROOT));
    }

    public int getItemNumber() { return itemNumber; }
    public String getName() { return name; }
    public String getBrand() { return brand; }
    public String getLocation() { return location; }
    public BigDecimal getPrice() { return price; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProductRecord)) return false;
        ProductRecord that = (ProductRecord) o;
        return itemNumber == that.itemNumber
                && name.equals(that.name)
                && brand.equals(that.brand)
                && location.equals(that.location)
                && (price == null ? that.price == null : that.price != null && price.compareTo(that.price) == 0);
    }

    @Override
    public int hashCode() {
        return Objects.hash(itemNumber, name, brand, location,
                price == null ? null : price.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return "ProductRecord{" +
                "#" + itemNumber +
                ", name='" + name + '\'' +
                ", brand='" + brand + '\'' +
                ", location='" + location + '\'' +
                ", price=" + price +
                '}';
    }
}
