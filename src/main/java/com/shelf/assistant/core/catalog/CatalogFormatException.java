package com.shelf.assistant.core.catalog;

/**
 * 目录 CSV 格式错误
 */
public class CatalogFormatException extends Exception {

    public CatalogFormatException(String message) {
        super(message);
    }

    public CatalogFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
