package com.confidentialpayroll.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Batch state. Contributors are listed in insertion order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResponse {

    private Long id;
    private boolean open;
    private List<String> contributors;
    private Integer contributorCount;
    private Instant openedAt;
    private Instant closedAt;
}
