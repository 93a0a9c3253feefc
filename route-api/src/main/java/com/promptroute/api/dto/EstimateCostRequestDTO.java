package com.promptroute.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 成本预估请求。models 为空时预估价格目录中的全部模型。
 */
@Data
public class EstimateCostRequestDTO {

    private Integer tokensIn;
    private Integer tokensOut;
    private List<String> models;
}
