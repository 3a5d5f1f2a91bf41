package com.confidentialpayroll.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Oracle result delivered over HTTP. Both fields are Base64.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecryptionCallbackRequest {

    @NotBlank(message = "Cleartexts are required")
    @Size(max = 1024, message = "Cleartexts must not exceed 1024 characters")
    private String cleartexts;

    @NotBlank(message = "Proof is required")
    @Size(max = 4096, message = "Proof must not exceed 4096 characters")
    private String proof;
}
