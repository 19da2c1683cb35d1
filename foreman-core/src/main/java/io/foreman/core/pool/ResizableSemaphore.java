package io.foreman.core.pool;

import java.util.concurrent.Semaphore;

/**
 * Fair semaphore whose permit count can be lowered at runtime.
 * Lowering may drive the available permits negative; holders release as usual and
 * new acquirers wait until the count is positive again.
 */
class ResizableSemaphore extends Semaphore {

    ResizableSemaphore(int permits) {
        super(permits, true);
    }

    void shrink(int reduction) {
        reducePermits(reduction);
    }
}
