package com.shelf.assistant.core.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProductCatalogCodec Tests")
class ProductCatalogCodecTest {

    private final ProductCatalogCodec codec = new ProductCatalogCodec();

    private static ProductCatalog catalog(ProductRecord... products) {
        return new ProductCatalog(List.of(products), Instant.parse("2025-01-15T10:30:00Z"));
    }

    @Nested
    @DisplayName("Encoding")
    class EncodingTests {

        @Test
        @DisplayName("Should write header and one row per product")
        void shouldWriteHeaderAndRows() {
            String csv = codec.encode(catalog(
                    new ProductRecord(1, "Cola", "Coca-Cola", "top shelf", new BigDecimal("1.99")),
                    new ProductRecord(2, "Chips", "Lay's", "middle shelf", null)));

            assertThat(csv).isEqualTo("item_number,product_name,brand,location,price\n"
                    + "1,Cola,Coca-Cola,top shelf,1.99\n"
                    + "2,Chips,Lay's,middle shelf,N/A\n");
        }

        @Test
        @DisplayName("Should quote fields containing separators and double embedded quotes")
        void shouldQuoteSpecialFields() {
            String csv = codec.encode(catalog(
                    new ProductRecord(1, "Cookies, Chocolate", "Brand \"X\"", "shelf 2\nleft", BigDecimal.ONE)));

            assertThat(csv).contains("1,\"Cookies, Chocolate\",\"Brand \"\"X\"\"\",\"shelf 2\nleft\",1");
        }

        @Test
        @DisplayName("Should encode an empty catalog as just the header")
        void shouldEncodeEmptyCatalog() {
            assertThat(codec.encode(catalog())).isEqualTo("item_number,product_name,brand,location,price\n");
        }
    }

    @Nested
    @DisplayName("Decoding")
    class DecodingTests {

        @Test
        @DisplayName("Should round-trip catalogs with awkward fields")
        void shouldRoundTrip() throws Exception {
            ProductCatalog original = catalog(
                    new ProductRecord(1, "Cola", "Coca-Cola", "top shelf", new BigDecimal("1.99")),
                    new ProductRecord(2, "Cookies, \"Chocolate\"", "", "bottom\r\nright", null),
                    new ProductRecord(3, "Water", "Evian", "", new BigDecimal("0.50")));

            ProductCatalog decoded = codec.decode(codec.encode(original));

            assertThat(decoded).isEqualTo(original);
            assertThat(decoded.getProducts().get(1).getPrice()).isNull();
        }

        @Test
        @DisplayName("Should accept columns in any order and header in any case")
        void shouldAcceptReorderedHeader() throws Exception {
            ProductCatalog decoded = codec.decode(" Price , ITEM_NUMBER,location,product_name,Brand\n"
                    + "$2.49,1,aisle 3,Milk,Dairy Co\n");

            ProductRecord milk = decoded.getProducts().get(0);
            assertThat(milk.getName()).isEqualTo("Milk");
            assertThat(milk.getBrand()).isEqualTo("Dairy Co");
            assertThat(milk.getLocation()).isEqualTo("aisle 3");
            assertThat(milk.getPrice()).isEqualByComparingTo("2.49");
        }

        @Test
        @DisplayName("Should skip blank lines and accept CRLF")
        void shouldSkipBlankLines() throws Exception {
            ProductCatalog decoded = codec.decode("item_number,product_name,brand,location,price\r\n"
                    + "\r\n1,Cola,Coca-Cola,top,1.99\r\n\r\n");

            assertThat(decoded.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should keep the requested version")
        void shouldKeepVersion() throws Exception {
            Instant version = Instant.parse("2025-02-01T00:00:00Z");
            ProductCatalog decoded = codec.decode("item_number,product_name,brand,location,price\n", version);

            assertThat(decoded.getVersion()).isEqualTo(version);
            assertThat(decoded.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Should reject a missing required column")
        void shouldRejectMissingColumn() {
            assertThatThrownBy(() -> codec.decode("item_number,product_name,brand,price\n1,Cola,Coke,1.99\n"))
                    .isInstanceOf(CatalogFormatException.class)
                    .hasMessageContaining("location");
        }

        @Test
        @DisplayName("Should reject a row with the wrong column count")
        void shouldRejectWrongColumnCount() {
            assertThatThrownBy(() -> codec.decode("item_number,product_name,brand,location,price\n1,Cola,Coke\n"))
                    .isInstanceOf(CatalogFormatException.class);
        }

        @Test
        @DisplayName("Should reject duplicate item numbers")
        void shouldRejectDuplicateNumbers() {
            assertThatThrownBy(() -> codec.decode("item_number,product_name,brand,location,price\n"
                    + "1,Cola,Coke,top,1\n1,Sprite,Coke,top,1\n"))
                    .isInstanceOf(CatalogFormatException.class)
                    .hasMessageContaining("Duplicate");
        }

        @Test
        @DisplayName("Should reject non-contiguous numbering")
        void shouldRejectGaps() {
            assertThatThrownBy(() -> codec.decode("item_number,product_name,brand,location,price\n"
                    + "1,Cola,Coke,top,1\n3,Sprite,Coke,top,1\n"))
                    .isInstanceOf(CatalogFormatException.class);
        }

        @Test
        @DisplayName("Should reject a non-integer item number")
        void shouldRejectNonIntegerNumber() {
            assertThatThrownBy(() -> codec.decode("item_number,product_name,brand,location,price\n"
                    + "one,Cola,Coke,top,1\n"))
                    .isInstanceOf(CatalogFormatException.class)
                    .hasMessageContaining("item_number");
        }

        @Test
        @DisplayName("Should reject an unparsable price")
        void shouldRejectBadPrice() {
            assertThatThrownBy(() -> codec.decode("item_number,product_name,brand,location,price\n"
                    + "1,Cola,Coke,top,cheap\n"))
                    .isInstanceOf(CatalogFormatException.class)
                    .hasMessageContaining("price");
        }

        @Test
        @DisplayName("Should reject an unterminated quoted field")
        void shouldRejectUnterminatedQuote() {
            assertThatThrownBy(() -> codec.decode("item_number,product_name,brand,location,price\n"
                    + "1,\"Cola,Coke,top,1\n"))
                    .isInstanceOf(CatalogFormatException.class);
        }

        @Test
        @DisplayName("Should reject empty input")
        void shouldRejectEmptyInput() {
            assertThatThrownBy(() -> codec.decode("   \n"))
                    .isInstanceOf(CatalogFormatException.class);
        }
    }

    @Test
    @DisplayName("Should treat N/A, NA and blank prices as unknown")
    void shouldParseUnknownPrices() throws Exception {
        assertThat(codec.parsePrice("N/A", 1)).isNull();
        assertThat(codec.parsePrice("na", 1)).isNull();
        assertThat(codec.parsePrice(" ", 1)).isNull();
        assertThat(codec.parsePrice("€3.20", 1)).isEqualByComparingTo("3.20");
    }
}
