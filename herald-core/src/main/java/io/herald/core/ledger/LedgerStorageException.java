package io.herald.core.ledger;

import java.io.IOException;

public class LedgerStorageException extends IOException {

    public LedgerStorageException(String message) {
        super(message);
    }

    public LedgerStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
