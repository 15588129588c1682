package com.thevig.backend.util;

import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

public final class TransactionCallbacks {

    private TransactionCallbacks() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Runs the action once the surrounding transaction commits, or right away
     * when there is none. Rolled-back transactions never run it.
     */
    public static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
