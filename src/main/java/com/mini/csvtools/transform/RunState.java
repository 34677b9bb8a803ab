package com.mini.csvtools.transform;

/**
 * 并行转换运行状态：IDLE -> DISPATCHING -> DRAINING -> DONE | ABORTED
 */
public enum RunState {
    IDLE,
    DISPATCHING,
    DRAINING,
    DONE,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }
}
