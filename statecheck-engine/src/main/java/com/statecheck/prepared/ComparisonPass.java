package com.statecheck.prepared;

/**
 * One execution pass over a set of comparisons. Once closed, leaves neither start nor record
 * results for this pass.
 */
final class ComparisonPass {
    private boolean open = true;

    synchronized boolean isOpen() {
        return open;
    }

    synchronized void close() {
        open = false;
    }

    /**
     * Runs a write while the pass is open; close waits for a write in progress.
     *
     * @return whether the write ran
     */
    synchronized boolean writeIfOpen(Runnable write) {
        if (!open) {
            return false;
        }
        write.run();
        return true;
    }
}
