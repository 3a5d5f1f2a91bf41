package com.confidentialpayroll.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for submitting a contribution into the current batch.
 *
 * A missing or blank handle is treated as an uninitialized ciphertext.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitContributionRequest {

    @NotBlank(message = "Identity is required")
    @Size(max = 128, message = "Identity must not exceed 128 characters")
    private String identity;

    @Size(max = 4096, message = "Salary handle must not exceed 4096 characters")
    private String salaryHandle;

    @Size(max = 4096, message = "Score handle must not exceed 4096 characters")
    private String scoreHandle;
}
