package com.shelf.assistant.core.phase;

import com.shelf.assistant.core.catalog.ProductCatalog;

/**
 * 新识别出的商品清单的去处（本地保存并后台上传）
 * <p>
 * submit 必须立即返回；结果通过 {@link PhaseStateMachine#onCatalogPublished} 或
 * {@link PhaseStateMachine#onCatalogRejected} 回调。
 */
public interface CatalogSink {

    void submit(ProductCatalog catalog);
}
