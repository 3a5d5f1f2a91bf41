package com.confidentialpayroll.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProtocolStatusResponse {

    private boolean available;
    private boolean paused;
    private Long currentBatchId;
    private boolean currentBatchOpen;
    private Integer stalledDecryptions;
    private String caller;
    private List<String> capabilities;
}
