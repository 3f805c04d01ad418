package com.shelf.assistant.core.catalog;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 商品目录 CSV 编解码
 * <p>
 * 列顺序固定: item_number,product_name,brand,location,price
 * <ul>
 *   <li>含逗号、引号或换行的字段加双引号，内部引号写两次</li>
 *   <li>价格缺失写作 N/A，解码时允许前导货币符号（如 $1.99）</li>
 *   <li>decode(encode(c)) 与 c 相等</li>
 * </ul>
 */
public class ProductCatalogCodec {

    public static final String COL_ITEM_NUMBER = "item_number";
    public static final String COL_PRODUCT_NAME = "product_name";
    public static final String COL_BRAND = "brand";
    public static final String COL_LOCATION = "location";
    public static final String COL_PRICE = "price";

    public static final List<String> COLUMNS = List.of(
            COL_ITEM_NUMBER, COL_PRODUCT_NAME, COL_BRAND, COL_LOCATION, COL_PRICE);

    public static final String PRICE_UNKNOWN = "N/A";

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';

    public String encode(ProductCatalog catalog) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.join(",", COLUMNS)).append('\n');
        for (ProductRecord product : catalog.getProducts()) {
            sb.append(product.getItemNumber()).append(DELIMITER)
                    .append(escape(product.getName())).append(DELIMITER)
                    .append(escape(product.getBrand())).append(DELIMITER)
                    .append(escape(product.getLocation())).append(DELIMITER)
                    .append(product.getPrice() == null ? PRICE_UNKNOWN : product.getPrice().toPlainString())
                    .append('\n');
        }
        return sb.toString();
    }

    public ProductCatalog decode(String text) throws CatalogFormatException {
        return decode(text, Instant.now());
    }

    public ProductCatalog decode(String text, Instant version) throws CatalogFormatException {
        List<List<String>> rows = parseRows(text);
        if (rows.isEmpty()) {
            throw new CatalogFormatException("Catalog is empty, header row is missing");
        }

        Map<String, Integer> header = indexHeader(rows.get(0));
        List<ProductRecord> products = new ArrayList<>();
        Set<Integer> seenNumbers = new HashSet<>();

        for (int r = 1; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            if (row.size() != rows.get(0).size()) {
                throw new CatalogFormatException("Row " + r + " has " + row.size()
                        + " columns, expected " + rows.get(0).size());
            }
            int itemNumber = parseItemNumber(row.get(header.get(COL_ITEM_NUMBER)), r);
            if (!seenNumbers.add(itemNumber)) {
                throw new CatalogFormatException("Duplicate item number " + itemNumber + " at row " + r);
            }
            String name = row.get(header.get(COL_PRODUCT_NAME));
            if (name.isBlank()) {
                throw new CatalogFormatException("Row " + r + " has an empty product_name");
            }
            products.add(new ProductRecord(
                    itemNumber,
                    name,
                    row.get(header.get(COL_BRAND)),
                    row.get(header.get(COL_LOCATION)),
                    parsePrice(row.get(header.get(COL_PRICE)), r)));
        }

        try {
            return new ProductCatalog(products, version);
        } catch (IllegalArgumentException e) {
            throw new CatalogFormatException(e.getMessage(), e);
        }
    }

    /**
     * 按 RFC 4180 读取所有行，字段去除首尾空白，跳过空行
     */
    public List<List<String>> parseRows(String text) throws CatalogFormatException {
        List<List<String>> rows = new ArrayList<>();
        if (text == null) {
            return rows;
        }

        List<String> row = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean fieldWasQuoted = false;
        int i = 0;
        int n = text.length();

        while (i < n) {
            char c = text.charAt(i);
            if (inQuotes) {
                if (c == QUOTE) {
                    if (i + 1 < n && text.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i += 2;
                        continue;
                    }
                    inQuotes = false;
                } else {
                    field.append(c);
                }
                i++;
                continue;
            }

            if (c == QUOTE && field.toString().isBlank()) {
                field.setLength(0);
                inQuotes = true;
                fieldWasQuoted = true;
            } else if (c == DELIMITER) {
                row.add(finishField(field, fieldWasQuoted));
                fieldWasQuoted = false;
            } else if (c == '\r' || c == '\n') {
                row.add(finishField(field, fieldWasQuoted));
                fieldWasQuoted = false;
                addRow(rows, row);
                row = new ArrayList<>();
                if (c == '\r' && i + 1 < n && text.charAt(i + 1) == '\n') {
                    i++;
                }
            } else if (!(fieldWasQuoted && Character.isWhitespace(c))) {
                field.append(c);
            }
            i++;
        }

        if (inQuotes) {
            throw new CatalogFormatException("Unterminated quoted field");
        }
        if (field.length() > 0 || fieldWasQuoted || !row.isEmpty()) {
            row.add(finishField(field, fieldWasQuoted));
            addRow(rows, row);
        }
        return rows;
    }

    /**
     * 表头列名到下标的映射，缺少必需列时报错
     */
    public Map<String, Integer> indexHeader(List<String> headerRow) throws CatalogFormatException {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < headerRow.size(); i++) {
            index.putIfAbsent(headerRow.get(i).trim().toLowerCase(Locale.ROOT), i);
        }
        List<String> missing = new ArrayList<>();
        for (String column : COLUMNS) {
            if (!index.containsKey(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new CatalogFormatException("Missing required columns: " + missing);
        }
        return index;
    }

    public BigDecimal parsePrice(String raw, int row) throws CatalogFormatException {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty() || value.equalsIgnoreCase(PRICE_UNKNOWN) || value.equalsIgnoreCase("NA")) {
            return null;
        }
        int start = 0;
        while (start < value.length() && !Character.isDigit(value.charAt(start))
                && value.charAt(start) != '-' && value.charAt(start) != '.') {
            start++;
        }
        String numeric = value.substring(start).trim();
        try {
            return new BigDecimal(numeric);
        } catch (NumberFormatException e) {
            throw new CatalogFormatException("Row " + row + " has an invalid price: '" + raw + "'", e);
        }
    }

    private int parseItemNumber(String raw, int row) throws CatalogFormatException {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new CatalogFormatException("Row " + row + " has an invalid item_number: '" + raw + "'", e);
        }
    }

    private static String finishField(StringBuilder field, boolean quoted) {
        String value = quoted ? field.toString() : field.toString().trim();
        field.setLength(0);
        return value;
    }

    private static void addRow(List<List<String>> rows, List<String> row) {
        // 空行只有一个空字段
        if (row.size() == 1 && row.get(0).isEmpty()) {
            return;
        }
        rows.add(row);
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        boolean needsQuotes = value.indexOf(DELIMITER) >= 0
                || value.indexOf(QUOTE) >= 0
                || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0;
        if (!needsQuotes) {
            return value;
        }
        return QUOTE + value.replace("\"", "\"\"") + QUOTE;
    }
}
