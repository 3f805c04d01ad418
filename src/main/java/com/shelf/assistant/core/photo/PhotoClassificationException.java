package com.shelf.assistant.core.photo;

/**
 * 文件名不符合命名约定，事件直接丢弃
 */
public class PhotoClassificationException extends Exception {
    private final String filename;

    public PhotoClassificationException(String filename, String reason) {
        super(reason + ": " + filename);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
