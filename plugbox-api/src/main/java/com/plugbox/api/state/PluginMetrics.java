package com.plugbox.api.state;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 插件运行指标
 */
@Data
@NoArgsConstructor
public class PluginMetrics {

    /**
     * 最近一次调用耗时 (ms)
     */
    private Long loadTime;

    /**
     * 最近一次调用在工作线程上分配的字节数，不支持时为 null
     */
    private Long memoryUsage;

    private long executionCount;

    private long errorCount;

    public PluginMetrics copy() {
        PluginMetrics copy = new PluginMetrics();
        copy.loadTime = this.loadTime;
        copy.memoryUsage = this.memoryUsage;
        copy.executionCount = this.executionCount;
        copy.errorCount = this.errorCount;
        return copy;
    }
}
