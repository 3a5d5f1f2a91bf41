package com.confidentialpayroll.application.exceptions;

/**
 * Caller lacks the capability required by the operation.
 */
public class AuthorizationException extends ProtocolException {

    public AuthorizationException(ErrorCode code, String message) {
        super(code, message);
    }

    public static AuthorizationException notAdmin(Object caller) {
        return new AuthorizationException(ErrorCode.NOT_ADMIN, "Caller " + caller + " is not an admin");
    }

    public static AuthorizationException notProvider(Object caller) {
        return new AuthorizationException(ErrorCode.NOT_PROVIDER, "Caller " + caller + " is not a data provider");
    }

    public static AuthorizationException notOracle(Object caller) {
        return new AuthorizationException(ErrorCode.NOT_ORACLE, "Caller " + caller + " is not the decryption oracle");
    }
}
