package com.project.sharestore.core;

/**
 * Outcome of a revoke request. NOT_FOUND and FORBIDDEN stay distinct; both are safe to
 * return to untrusted callers since edit tokens are not guessable.
 */
public enum RevokeResult {
    OK,
    NOT_FOUND,
    FORBIDDEN,
    ALREADY_REVOKED,
    UNSUPPORTED
}
