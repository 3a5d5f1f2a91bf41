package com.confidentialpayroll.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CiphertextResponse {

    /**
     * Base64 ciphertext handle.
     */
    private String handle;
}
