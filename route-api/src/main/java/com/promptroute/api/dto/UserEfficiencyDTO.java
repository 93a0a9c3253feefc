package com.promptroute.api.dto;

import lombok.Data;

@Data
public class UserEfficiencyDTO {

    private String user;
    private Long decisionsWithOutcome;
    private Long highValueNonDowngraded;
    private Double efficiencyScore;
}
