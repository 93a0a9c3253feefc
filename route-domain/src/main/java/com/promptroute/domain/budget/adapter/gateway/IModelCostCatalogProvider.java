package com.promptroute.domain.budget.adapter.gateway;

import com.promptroute.domain.budget.model.valobj.ModelCostCatalog;

/**
 * 模型价格目录来源。
 */
public interface IModelCostCatalogProvider {

    ModelCostCatalog catalog();
}
