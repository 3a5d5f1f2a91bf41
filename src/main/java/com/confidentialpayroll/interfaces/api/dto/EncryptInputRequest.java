package com.confidentialpayroll.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Plaintext to encrypt into a ciphertext handle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EncryptInputRequest {

    @NotNull(message = "Value is required")
    @PositiveOrZero(message = "Value must not be negative")
    private Long value;

    @Override
    public String toString() {
        return "EncryptInputRequest[value=***]";
    }
}
