package com.secondhand.error;

/**
 * Category of a failed market operation.
 */
public enum ErrorKind {

    /**
     * Malformed input or a missing record. Nothing was changed.
     */
    VALIDATION,

    /**
     * The ledger refused a debit. The operation was rolled back completely.
     */
    FUNDS,

    /**
     * The target was already resolved by an earlier request. Treated as a no-op.
     */
    RACE
}
