package com.shelf.assistant.core.phase;

import com.shelf.assistant.core.catalog.ProductCatalog;
import com.shelf.assistant.core.catalog.ProductRecord;
import com.shelf.assistant.core.guidance.Offset;
import com.shelf.assistant.model.UserChoice;

/**
 * 会话状态的只读快照（状态接口使用，不持有锁）
 */
public final class SessionSnapshot {
    private final Phase phase;
    private final ProductCatalog activeCatalog;
    private final boolean catalogPublished;
    private final ProductRecord selectedItem;
    private final UserChoice activeChoice;
    private final Offset lastGuidanceOffset;
    private final int consecutiveReachedCycles;
    private final int consecutiveStoreFailures;
    private final long generation;
    private final int pendingAcknowledgements;

    SessionSnapshot(Phase phase, ProductCatalog activeCatalog, boolean catalogPublished,
                    ProductRecord selectedItem, UserChoice activeChoice, Offset lastGuidanceOffset,
                    int consecutiveReachedCycles, int consecutiveStoreFailures,
                    long generation, int pendingAcknowledgements) {
        this.phase = phase;
        this.activeCatalog = activeCatalog;
        this.catalogPublished = catalogPublished;
        this.selectedItem = selectedItem;
        this.activeChoice = activeChoice;
        this.lastGuidanceOffset = lastGuidanceOffset;
        this.consecutiveReachedCycles = consecutiveReachedCycles;
        this.consecutiveStoreFailures = consecutiveStoreFailures;
        this.generation = generation;
        this.pendingAcknowledgements = pendingAcknowledgements;
    }

    public Phase getPhase() { return phase; }
    public ProductCatalog getActiveCatalog() { return activeCatalog; }
    public boolean isCatalogPublished() { return catalogPublished; }
    public ProductRecord getSelectedItem() { return selectedItem; }
    public UserChoice getActiveChoice() { return activeChoice; }
    public Offset getLastGuidanceOffset() { return lastGuidanceOffset; }
    public int getConsecutiveReachedCycles() { return consecutiveReachedCycles; }
    public int getConsecutiveStoreFailures() { return consecutiveStoreFailures; }
    public long getGeneration() { return generation; }
    public int getPendingAcknowledgements() { return pendingAcknowledgements; }
}
