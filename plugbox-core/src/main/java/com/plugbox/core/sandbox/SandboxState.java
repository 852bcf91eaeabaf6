package com.plugbox.core.sandbox;

/**
 * 沙箱状态机：UNINITIALIZED → INITIALIZING → READY → TERMINATED
 * 初始化失败直接进入 TERMINATED，不可重入。
 */
public enum SandboxState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    TERMINATED
}
