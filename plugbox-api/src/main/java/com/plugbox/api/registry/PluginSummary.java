package com.plugbox.api.registry;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 注册中心目录中的插件元数据
 */
@Value
@Builder
public class PluginSummary {
    String id;
    String name;
    String description;
    /**
     * 插件类型取值，与清单 type 一致（小写）
     */
    String type;
    @Singular
    List<String> categories;
    @Singular
    List<String> tags;
    /**
     * 最新版本
     */
    String version;
}
