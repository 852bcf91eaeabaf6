package com.example.widget;

/**
 * 不在宿主包下的类，用于验证插件优先加载
 */
public class Widget {

    public String origin() {
        return getClass().getClassLoader().getName();
    }
}
