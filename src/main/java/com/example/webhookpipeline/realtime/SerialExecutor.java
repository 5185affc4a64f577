package com.example.webhookpipeline.realtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * 在共享线程池上按提交顺序逐个执行任务。
 * <p>
 * 共享线程池拒绝某个任务时，该任务的拒绝回调在锁外执行，队列继续调度后续任务，不会卡死。
 */
class SerialExecutor {

    private final Queue<Task> tasks = new ArrayDeque<>();
    private final Executor delegate;
    private Runnable active;

    SerialExecutor(Executor delegate) {
        this.delegate = delegate;
    }

    /**
     * @param command    要执行的任务
     * @param onRejected 共享线程池拒绝该任务时调用，可能在提交线程或上一个任务的线程上执行
     */
    void execute(Runnable command, Consumer<RejectedExecutionException> onRejected) {
        List<Rejection> rejected;
        synchronized (this) {
            tasks.add(new Task(command, onRejected));
            if (active != null) {
                return;
            }
            rejected = scheduleNext();
        }
        notifyRejected(rejected);
    }

    synchronized boolean isIdle() {
        return active == null && tasks.isEmpty();
    }

    private void runAndContinue(Runnable command) {
        try {
            command.run();
        } finally {
            List<Rejection> rejected;
            synchronized (this) {
                rejected = scheduleNext();
            }
            notifyRejected(rejected);
        }
    }

    // 调用方持有锁
    private List<Rejection> scheduleNext() {
        List<Rejection> rejected = new ArrayList<>();
        Task next;
        while ((next = tasks.poll()) != null) {
            Runnable command = next.command;
            active = () -> runAndContinue(command);
            try {
                delegate.execute(active);
                return rejected;
            } catch (RejectedExecutionException e) {
                rejected.add(new Rejection(next, e));
            }
        }
        active = null;
        return rejected;
    }

    private static void notifyRejected(List<Rejection> rejected) {
        for (Rejection rejection : rejected) {
            rejection.task.onRejected.accept(rejection.cause);
        }
    }

    private static final class Task {
        private final Runnable command;
        private final Consumer<RejectedExecutionException> onRejected;

        private Task(Runnable command, Consumer<RejectedExecutionException> onRejected) {
            this.command = command;
            this.onRejected = onRejected;
        }
    }

    private static final class Rejection {
        private final Task task;
        private final RejectedExecutionException cause;

        private Rejection(Task task, RejectedExecutionException cause) {
            this.task = task;
            this.cause = cause;
        }
    }
}
