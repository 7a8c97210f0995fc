package com.marketterminal.market_terminal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HealthDto {
    private String status;
    private String timestamp;

    @JsonProperty("broker_status")
    private String brokerStatus;
}
