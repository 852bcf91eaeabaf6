package com.plugbox.core.fixture;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * 构造测试用清单与插件包
 */
public final class PluginPackages {

    private PluginPackages() {
    }

    /**
     * 最小合法清单
     */
    public static Map<String, Object> manifest(String id, String version, Class<?> main) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", id);
        raw.put("name", "Plugin " + id);
        raw.put("version", version);
        raw.put("description", "Test plugin " + id);
        raw.put("type", "tool");
        raw.put("engine", new LinkedHashMap<>(Map.of("host", ">=1.0.0")));
        raw.put("capabilities", List.of());
        raw.put("main", main.getName());
        return raw;
    }

    public static String yaml(Map<String, Object> manifest) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(manifest);
    }

    /**
     * 只含 plugin.yml 的插件包
     */
    public static byte[] zip(Map<String, Object> manifest) {
        return zip(manifest, Map.of());
    }

    public static byte[] zip(Map<String, Object> manifest, Map<String, String> extraFiles) {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("plugin.yml", yaml(manifest));
        entries.putAll(extraFiles);
        return zipEntries(entries);
    }

    /**
     * 任意条目，名称原样写入（可用于构造 zip-slip）
     */
    public static byte[] zipEntries(Map<String, String> entries) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }
}
