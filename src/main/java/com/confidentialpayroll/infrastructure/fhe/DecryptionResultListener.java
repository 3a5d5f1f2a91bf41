package com.confidentialpayroll.infrastructure.fhe;

import com.confidentialpayroll.domain.model.Identity;

/**
 * Receiver of oracle callbacks.
 */
public interface DecryptionResultListener {

    void onDecryptionResult(Identity oracle, long requestId, byte[] cleartexts, byte[] proof);
}
