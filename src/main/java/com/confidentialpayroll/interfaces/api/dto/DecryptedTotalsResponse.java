package com.confidentialpayroll.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecryptedTotalsResponse {

    private Long requestId;
    private String totalSalary;
    private String totalBonus;
}
