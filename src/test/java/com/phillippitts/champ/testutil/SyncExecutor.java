package com.phillippitts.champ.testutil;

import java.util.concurrent.Executor;

/**
 * Runs tasks immediately on the calling thread so dispatch order is deterministic.
 */
public class SyncExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
