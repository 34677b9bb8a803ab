package com.mini.csvtools.utils;

import com.mini.csvtools.exception.RunCancelledException;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 任务级取消信号
 * 调用方在任意线程调用 cancel()，执行方在安全点调用 throwIfCancelled()
 */
public class CancellationSignal {

    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * 创建一个新的、未取消的信号
     */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancel("cancelled by caller");
    }

    /**
     * 请求取消，只有第一次调用的原因会被保留
     */
    public void cancel(String why) {
        reason.compareAndSet(null, why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * 已取消时抛出 RunCancelledException
     *
     * @param stage 当前所处阶段，用于错误信息
     */
    public void throwIfCancelled(String stage) {
        String why = reason.get();
        if (why != null) {
            throw new RunCancelledException("Run cancelled during " + stage + ": " + why);
        }
    }
}
