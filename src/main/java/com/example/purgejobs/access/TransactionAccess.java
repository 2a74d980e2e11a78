package com.example.purgejobs.access;

public interface TransactionAccess {
    /**
     * Opens a write transaction. Nothing is written until {@link WriteTransaction#commit()}.
     */
    WriteTransaction begin();
}
