package com.shelf.assistant.event;

import com.shelf.assistant.model.CatalogRecord;
import org.springframework.context.ApplicationEvent;

/**
 * 商品清单上传结束（成功或被后端拒绝）
 */
public class CatalogUploadEvent extends ApplicationEvent {

    public enum Outcome { PUBLISHED, REJECTED }

    private final CatalogRecord record;
    private final Outcome outcome;

    public CatalogUploadEvent(Object source, CatalogRecord record, Outcome outcome) {
        super(source);
        this.record = record;
        this.outcome = outcome;
    }

    public CatalogRecord getRecord() {
        return record;
    }

    public Outcome getOutcome() {
        return outcome;
    }
}
