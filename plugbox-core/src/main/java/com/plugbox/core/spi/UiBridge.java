package com.plugbox.core.spi;

import java.util.Map;

/**
 * 宿主 UI 桥接 SPI
 */
public interface UiBridge {

    void registerPanel(String pluginId, Map<String, Object> panel);

    void registerCommand(String pluginId, Map<String, Object> command);

    void registerMenuItem(String pluginId, Map<String, Object> item);

    void showNotification(String pluginId, Map<String, Object> notification);
}
