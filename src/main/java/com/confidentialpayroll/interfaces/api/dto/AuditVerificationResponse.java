package com.confidentialpayroll.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditVerificationResponse {

    private boolean intact;
    private Integer entries;
    private Long firstBrokenSequence;
}
