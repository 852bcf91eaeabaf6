package com.plugbox.core.fixture;

/**
 * 没有实现 SandboxedPlugin 的入口类
 */
public class NotAPlugin {
}
