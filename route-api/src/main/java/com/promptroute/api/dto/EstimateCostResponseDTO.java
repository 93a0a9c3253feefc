package com.promptroute.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 成本预估结果，按花费升序。
 */
@Data
public class EstimateCostResponseDTO {

    private Integer tokensIn;
    private Integer tokensOut;
    private List<ModelCostEstimateDTO> estimates;
}
