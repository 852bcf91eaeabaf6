package com.plugbox.core.manifest;

import com.plugbox.api.exception.ValidationException;
import com.plugbox.api.manifest.PluginManifest;
import com.plugbox.core.loader.YamlDescriptors;

import java.util.*;

/**
 * 配置项类型校验
 * 只校验 configSchema 中声明过的键的类型，未声明的键原样接受；
 * 所有值都必须能写入 state.yml 并原样读回。
 */
public final class ConfigSchemaValidator {

    private ConfigSchemaValidator() {
    }

    public static void validate(PluginManifest manifest, Map<String, Object> patch) {
        List<String> problems = new ArrayList<>();
        patch.forEach((key, value) -> {
            Optional<String> nonPlain = YamlDescriptors.findNonPlain(value, String.valueOf(key));
            if (nonPlain.isPresent()) {
                problems.add(nonPlain.get() + " holds an unsupported value type");
                return;
            }
            Map<String, Object> descriptor = manifest.getConfigSchema().get(key);
            if (descriptor == null || value == null || descriptor.get("type") == null) {
                return;
            }
            ConfigType.fromValue(String.valueOf(descriptor.get("type")))
                    .filter(type -> !type.accepts(value))
                    .ifPresent(type -> problems.add(key + " must be of type " + type.value));
        });
        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid config for plugin " + manifest.getId() + ": "
                    + String.join("; ", problems));
        }
    }

    public enum ConfigType {
        STRING("string"),
        NUMBER("number"),
        BOOLEAN("boolean"),
        OBJECT("object"),
        ARRAY("array");

        private final String value;

        ConfigType(String value) {
            this.value = value;
        }

        public static Optional<ConfigType> fromValue(String value) {
            return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
        }

        boolean accepts(Object candidate) {
            return switch (this) {
                case STRING -> candidate instanceof String;
                case NUMBER -> candidate instanceof Number;
                case BOOLEAN -> candidate instanceof Boolean;
                case OBJECT -> candidate instanceof Map;
                case ARRAY -> candidate instanceof List;
            };
        }
    }
}
