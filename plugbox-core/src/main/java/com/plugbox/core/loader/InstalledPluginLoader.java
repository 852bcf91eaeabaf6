package com.plugbox.core.loader;

import com.plugbox.core.config.PlugBoxConfig;
import com.plugbox.core.plugin.PluginManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * 已安装插件恢复服务
 * <p>
 * 职责：
 * 1. 扫描插件根目录下的每个子目录
 * 2. 跳过没有 plugin.yml 的目录（临时文件或无关文件夹）
 * 3. 逐个交给 PluginManager 恢复，单个插件失败只记录日志
 */
@Slf4j
@RequiredArgsConstructor
public class InstalledPluginLoader {

    private final PlugBoxConfig config;
    private final PluginManager pluginManager;

    /**
     * 执行扫描并加载
     *
     * @return 成功恢复的插件数
     */
    public int scanAndLoad() {
        Path root = config.getPluginsRoot();
        if (!isValidRoot(root)) {
            return 0;
        }
        List<Path> candidates;
        try (Stream<Path> children = Files.list(root)) {
            candidates = children.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            log.error("Failed to list plugins root {}", root, e);
            return 0;
        }
        log.info("Starting plugin restore from {}, count: {}", root, candidates.size());

        int loaded = 0;
        for (Path dir : candidates) {
            if (!Files.isRegularFile(dir.resolve(PluginManifestLoader.MANIFEST_FILE))) {
                log.debug("Skipping {}: no manifest", dir);
                continue;
            }
            try {
                pluginManager.restore(dir);
                loaded++;
            } catch (RuntimeException e) {
                // 坏插件只打印报错，不影响其他插件
                log.error("Failed to restore plugin from {}: {}", dir, e.getMessage());
            }
        }
        log.info("Plugin restore finished. Total loaded: {}", loaded);
        return loaded;
    }

    private boolean isValidRoot(Path root) {
        if (!Files.exists(root)) {
            log.warn("Plugins root does not exist: {}", root.toAbsolutePath());
            return false;
        }
        if (!Files.isDirectory(root)) {
            log.warn("Plugins root is not a directory: {}", root.toAbsolutePath());
            return false;
        }
        if (!Files.isReadable(root)) {
            log.error("Plugins root is not readable: {}", root.toAbsolutePath());
            return false;
        }
        return true;
    }
}
