package com.plugbox.api.registry;

import lombok.Builder;
import lombok.Value;

/**
 * 注册中心检索条件
 * <p>
 * limit 为 null 时取默认上限；0 或负数表示不返回结果，而不是不限。
 * </p>
 */
@Value
@Builder
public class SearchOptions {
    String category;
    String type;
    Integer limit;

    public static SearchOptions defaults() {
        return SearchOptions.builder().build();
    }
}
