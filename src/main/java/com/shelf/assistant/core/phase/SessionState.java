package com.shelf.assistant.core.phase;

import com.shelf.assistant.core.catalog.ProductCatalog;
import com.shelf.assistant.core.catalog.ProductRecord;
import com.shelf.assistant.core.guidance.Offset;
import com.shelf.assistant.model.UserChoice;

/**
 * 单次购物会话的可变状态，只在 {@link PhaseStateMachine} 的锁内读写
 */
class SessionState {
    Phase phase = Phase.POSITIONING;
    ProductCatalog activeCatalog;
    boolean catalogPublished;
    ProductRecord selectedItem;
    UserChoice activeChoice;
    Offset lastGuidanceOffset;
    int consecutiveReachedCycles;
    int consecutiveStoreFailures;

    SessionSnapshot snapshot(long generation, int pendingAcknowledgements) {
        return new SessionSnapshot(phase, activeCatalog, catalogPublished, selectedItem, activeChoice,
                lastGuidanceOffset, consecutiveReachedCycles, consecutiveStoreFailures,
                generation, pendingAcknowledgements);
    }
}
