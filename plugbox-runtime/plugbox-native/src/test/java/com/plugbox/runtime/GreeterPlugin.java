package com.plugbox.runtime;

import com.plugbox.api.plugin.PluginApi;
import com.plugbox.api.plugin.SandboxedPlugin;

import java.util.List;

/**
 * 测试插件：按配置的称呼问候
 */
public class GreeterPlugin implements SandboxedPlugin {

    private volatile PluginApi api;

    @Override
    public void initialize(PluginApi api) {
        this.api = api;
    }

    @Override
    public Object invoke(String method, List<Object> args) {
        if (!"greet".equals(method)) {
            throw new UnsupportedOperationException(method);
        }
        Object greeting = api.getConfig().getOrDefault("greeting", "Hello");
        return greeting + ", " + args.get(0);
    }
}
