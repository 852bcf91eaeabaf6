package com.plugbox.core.fixture;

import com.plugbox.api.plugin.PluginApi;
import com.plugbox.api.plugin.SandboxedPlugin;

import java.util.List;

/**
 * initialize 钩子必定失败
 */
public class FailingInitPlugin implements SandboxedPlugin {

    @Override
    public void initialize(PluginApi api) {
        throw new IllegalStateException("init exploded");
    }

    @Override
    public Object invoke(String method, List<Object> args) {
        return method;
    }
}
