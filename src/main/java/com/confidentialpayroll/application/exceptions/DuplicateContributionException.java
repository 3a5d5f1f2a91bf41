package com.confidentialpayroll.application.exceptions;

public class DuplicateContributionException extends ProtocolException {

    public DuplicateContributionException(Object identity, long batchId) {
        super(ErrorCode.DUPLICATE_CONTRIBUTION,
            identity + " already contributed to batch " + batchId);
    }
}
