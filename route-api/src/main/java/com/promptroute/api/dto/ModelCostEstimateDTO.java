package com.promptroute.api.dto;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class ModelCostEstimateDTO {

    private String model;
    private BigDecimal costUsd;
    /** 模型是否在价格目录中，未知模型按 0 计价 */
    private Boolean known;
}
