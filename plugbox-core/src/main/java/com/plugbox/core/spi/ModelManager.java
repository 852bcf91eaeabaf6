package com.plugbox.core.spi;

import java.util.Map;

/**
 * 模型管理 SPI（宿主提供）
 */
public interface ModelManager {

    Object execute(String modelId, String prompt, Map<String, Object> options);
}
