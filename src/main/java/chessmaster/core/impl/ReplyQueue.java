package chessmaster.core.impl;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;

/**
 * Executor that only queues; tasks run when the owner calls {@link #drain()}. Lets a front end
 * print the human move before the automated reply is computed, all on one thread.
 */
public final class ReplyQueue implements Executor {

    private final Queue<Runnable> pending = new ArrayDeque<>();

    @Override
    public void execute(Runnable task) {
        pending.add(task);
    }

    /** Runs queued tasks, including any they enqueue, until none are left. */
    public int drain() {
        int n = 0;
        Runnable r;
        while ((r = pending.poll()) != null) {
            r.run();
            n++;
        }
        return n;
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
