package com.mini.csvtools.transform;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mini.csvtools.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 固定大小的工作线程池
 *
 * 通信只通过两个通道：
 * 1. 有界任务队列（容量 queueDepth），满时 submit 阻塞，形成背压
 * 2. 结果队列，工作线程把 TaskResult 放入，协调线程取出
 *
 * 工作线程之间不共享可变状态，收到毒丸后退出。
 */
public class WorkerPool {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final int workers;
    private final BlockingQueue<Task> taskQueue;
    private final BlockingQueue<TaskResult> resultQueue = new LinkedBlockingQueue<>();
    private final ExecutorService executor;

    private final AtomicLong completedTasks = new AtomicLong(0);
    /** 不再接受新任务 */
    private volatile boolean stopped = false;

    /** 已中止，工作线程处理完手头任务后直接退出 */
    private volatile boolean aborted = false;

    /** 第一个导致工作线程退出的 Error */
    private final AtomicReference<Error> fatalError = new AtomicReference<>();

    private WorkerPool(int workers, int queueDepth) {
        this.workers = workers;
        this.taskQueue = new ArrayBlockingQueue<>(queueDepth);
        this.executor = Executors.newFixedThreadPool(workers, new ThreadFactoryBuilder()
                .setNameFormat("csv-transform-worker-%d")
                .setDaemon(true)
                .build());
        for (int i = 0; i < workers; i++) {
            executor.execute(this::workLoop);
        }
    }

    /**
     * 启动线程池
     *
     * @param workers 工作线程数，必须大于 0
     * @param queueDepth 任务队列容量，必须大于 0
     */
    public static WorkerPool start(int workers, int queueDepth) {
        if (workers <= 0) {
            throw new ConfigurationException("Worker count must be positive, got " + workers);
        }
        if (queueDepth <= 0) {
            throw new ConfigurationException("Task queue depth must be positive, got " + queueDepth);
        }
        WorkerPool pool = new WorkerPool(workers, queueDepth);
        logger.info("WorkerPool started with {} workers and queue depth {}", workers, queueDepth);
        return pool;
    }

    private void workLoop() {
        try {
            while (!aborted) {
                Task task = taskQueue.take();
                if (task == Task.POISON) {
                    break;
                }
                TaskResult result = task.run();
                completedTasks.incrementAndGet();
                resultQueue.add(result);
                logger.debug("Worker {} finished {}", Thread.currentThread().getName(), result);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Worker {} interrupted", Thread.currentThread().getName());
        } catch (Error e) {
            fatalError.compareAndSet(null, e);
            logger.error("Worker {} died", Thread.currentThread().getName(), e);
            throw e;
        }
    }

    /**
     * 提交任务，任务队列满时阻塞
     */
    public void submit(Task task) throws InterruptedException {
        if (stopped) {
            throw new IllegalStateException("WorkerPool is stopped");
        }
        taskQueue.put(task);
    }

    /**
     * 阻塞等待下一个完成的结果
     */
    public TaskResult takeResult() throws InterruptedException {
        return resultQueue.take();
    }

    /**
     * 在超时时间内等待下一个完成的结果，超时返回 null
     */
    public TaskResult pollResult(long timeout, TimeUnit unit) throws InterruptedException {
        return resultQueue.poll(timeout, unit);
    }

    /**
     * 非阻塞地取一个已完成的结果，没有时返回 null
     */
    public TaskResult pollResult() {
        return resultQueue.poll();
    }

    /**
     * 正常关闭：等已提交的任务执行完，然后停止并等待所有工作线程退出
     */
    public void shutdown() {
        if (stopped) {
            return;
        }
        stopped = true;
        try {
            for (int i = 0; i < workers; i++) {
                taskQueue.put(Task.POISON);
            }
            executor.shutdown();
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Workers did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for workers to stop", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("WorkerPool shut down after {} tasks", completedTasks.get());
    }

    /**
     * 中止：丢弃排队的任务并中断工作线程
     */
    public void abort() {
        if (aborted) {
            return;
        }
        stopped = true;
        aborted = true;
        int dropped = taskQueue.size();
        taskQueue.clear();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Workers still running after abort");
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for aborted workers", e);
            Thread.currentThread().interrupt();
        }
        resultQueue.clear();
        logger.info("WorkerPool aborted, dropped {} queued tasks", dropped);
    }

    /**
     * 导致工作线程退出的第一个 Error，没有时返回 null
     */
    public Error getFatalError() {
        return fatalError.get();
    }

    public int getWorkers() {
        return workers;
    }

    public long getCompletedTasks() {
        return completedTasks.get();
    }

    public boolean isStopped() {
        return stopped;
    }

    /**
     * 所有工作线程都已退出
     */
    public boolean isTerminated() {
        return executor.isTerminated();
    }
}
