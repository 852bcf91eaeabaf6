package com.plugbox.core.manifest;

import com.plugbox.api.exception.ValidationException;
import com.plugbox.api.manifest.PluginManifest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigSchemaValidator 单元测试")
class ConfigSchemaValidatorTest {

    private PluginManifest manifest;

    @BeforeEach
    void setUp() {
        manifest = PluginManifest.builder()
                .id("web-scraper")
                .version("1.0.0")
                .configSchemaEntry("depth", Map.of("type", "number"))
                .configSchemaEntry("userAgent", Map.of("type", "string"))
                .configSchemaEntry("followLinks", Map.of("type", "boolean"))
                .configSchemaEntry("headers", Map.of("type", "object"))
                .configSchemaEntry("allowList", Map.of("type", "array"))
                .build();
    }

    @Test
    @DisplayName("类型匹配的补丁应通过")
    void matchingTypesShouldPass() {
        assertDoesNotThrow(() -> ConfigSchemaValidator.validate(manifest, Map.of(
                "depth", 3,
                "userAgent", "plugbox",
                "followLinks", true,
                "headers", Map.of("x", "y"),
                "allowList", List.of("a"))));
    }

    @Test
    @DisplayName("类型不匹配应列出所有问题")
    void mismatchedTypesShouldFail() {
        Map<String, Object> patch = new HashMap<>();
        patch.put("depth", "deep");
        patch.put("followLinks", "yes");

        ValidationException e = assertThrows(ValidationException.class,
                () -> ConfigSchemaValidator.validate(manifest, patch));

        assertTrue(e.getMessage().contains("depth must be of type number"), e.getMessage());
        assertTrue(e.getMessage().contains("followLinks must be of type boolean"), e.getMessage());
    }

    @Test
    @DisplayName("未声明的键与 null 值不做校验")
    void undeclaredKeysAndNullsShouldPass() {
        Map<String, Object> patch = new HashMap<>();
        patch.put("unknown", 1);
        patch.put("depth", null);

        assertDoesNotThrow(() -> ConfigSchemaValidator.validate(manifest, patch));
    }
}
