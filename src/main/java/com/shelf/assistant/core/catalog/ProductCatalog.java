package com.shelf.assistant.core.catalog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 一次货架识别得到的商品目录
 * <p>
 * 商品按识别顺序排列，编号必须为 1..n 连续且唯一。
 * version 为目录创建时间，仅用于区分不同批次，不参与相等比较。
 */
public final class ProductCatalog {
    private final List<ProductRecord> products;
    private final Instant version;

    public ProductCatalog(List<ProductRecord> products, Instant version) {
        List<ProductRecord> copy = new ArrayList<>(products);
        for (int i = 0; i < copy.size(); i++) {
            int expected = i + 1;
            int actual = copy.get(i).getItemNumber();
            if (actual != expected) {
                throw new IllegalArgumentException("Item numbers must run 1.." + copy.size()
                        + " in order; position " + expected + " has item number " + actual);
            }
        }
        this.products = Collections.unmodifiableList(copy);
        this.version = version;
    }

    /**
     * 由识别草稿构建目录，按顺序重新编号
     */
    public static ProductCatalog fromDrafts(List<ProductRecord> drafts, Instant version) {
        List<ProductRecord> numbered = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            numbered.add(drafts.get(i).withItemNumber(i + 1));
        }
        return new ProductCatalog(numbered, version);
    }

    public List<ProductRecord> getProducts() {
        return products;
    }

    public Instant getVersion() {
        return version;
    }

    public int size() {
        return products.size();
    }

    public boolean isEmpty() {
        return products.isEmpty();
    }

    public Optional<ProductRecord> findByName(String itemName) {
        return products.stream().filter(p -> p.matchesName(itemName)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProductCatalog)) return false;
        return products.equals(((ProductCatalog) o).products);
    }

    @Override
    public int hashCode() {
        return products.hashCode();
    }

    @Override
    public String toString() {
        return "ProductCatalog{version=" + version + ", products=" + products + '}';
    }
}
