package com.plugbox.api.event.lifecycle;

import com.plugbox.api.exception.ErrorKind;
import lombok.Getter;

/**
 * 生命周期操作失败事件基类，携带底层原因
 */
@Getter
public abstract class PluginFailureEvent extends PluginLifecycleEvent {
    private final ErrorKind errorKind;
    private final String error;

    protected PluginFailureEvent(String pluginId, String version, ErrorKind errorKind, String error) {
        super(pluginId, version);
        this.errorKind = errorKind;
        this.error = error;
    }

    @Override
    public String toString() {
        return super.toString() + " error=" + errorKind + ":" + error;
    }
}
