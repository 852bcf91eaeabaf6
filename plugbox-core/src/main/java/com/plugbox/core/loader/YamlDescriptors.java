package com.plugbox.core.loader;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * YAML 描述文件读写 (plugin.yml / state.yml)
 * <p>
 * 只使用 SafeConstructor：描述文件来自不可信的插件包，禁止任意类型构造。
 * 写入先落临时文件再原子替换，避免宿主崩溃时留下半个文件。
 * 写入只接受 SafeConstructor 能读回的值：字符串、数字、布尔、null 以及由它们组成的列表和映射。
 */
public final class YamlDescriptors {

    private static final Set<Class<?>> PLAIN_SCALARS = Set.of(
            String.class, Boolean.class,
            Integer.class, Long.class, Short.class, Byte.class, BigInteger.class,
            Double.class, Float.class, BigDecimal.class);

    private YamlDescriptors() {
    }

    /**
     * 读取为原始结构，文档为空时返回 null
     */
    public static Map<String, Object> read(InputStream inputStream) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        Object document = yaml.load(inputStream);
        if (document == null) {
            return null;
        }
        if (!(document instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Descriptor root must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) document;
        return map;
    }

    public static Map<String, Object> read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public static void write(Path file, Map<String, Object> content) throws IOException {
        findNonPlain(content, "").ifPresent(path -> {
            throw new IllegalArgumentException("Value at '" + path + "' cannot be stored in " + file.getFileName());
        });

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        options.setIndent(2);
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()), new PlainRepresenter(options), options);

        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            yaml.dump(content, writer);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * 查找第一个无法安全读回的值
     *
     * @return 该值的路径（如 {@code config.since}、{@code tags[2]}），全部可写时为 empty
     */
    public static Optional<String> findNonPlain(Object value, String path) {
        if (value == null || PLAIN_SCALARS.contains(value.getClass())) {
            return Optional.empty();
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    return Optional.of(path.isEmpty() ? String.valueOf(entry.getKey()) : path + "." + entry.getKey());
                }
                Optional<String> nested = findNonPlain(entry.getValue(), path.isEmpty() ? key : path + "." + key);
                if (nested.isPresent()) {
                    return nested;
                }
            }
            return Optional.empty();
        }
        if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                Optional<String> nested = findNonPlain(list.get(i), path + "[" + i + "]");
                if (nested.isPresent()) {
                    return nested;
                }
            }
            return Optional.empty();
        }
        return Optional.of(path);
    }

    /**
     * 不输出 JavaBean 与自定义标签
     */
    private static final class PlainRepresenter extends Representer {

        private PlainRepresenter(DumperOptions options) {
            super(options);
            this.representers.put(null, data -> {
                throw new YAMLException("Refusing to write " + data.getClass().getName());
            });
        }
    }
}
