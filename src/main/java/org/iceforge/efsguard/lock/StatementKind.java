package org.iceforge.efsguard.lock;

/**
 * Coarse classification of a statement for locking purposes.
 */
public enum StatementKind {
    TRANSACTION_START,
    WRITE,
    READ
}
