package com.plugbox.core.loader;

import com.plugbox.api.exception.PlugBoxException;
import com.plugbox.api.exception.ErrorKind;
import com.plugbox.api.exception.ValidationException;
import com.plugbox.api.manifest.PluginManifest;
import com.plugbox.core.manifest.ManifestValidator;
import com.plugbox.core.manifest.ManifestWriter;
import lombok.RequiredArgsConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 插件清单加载器：读取插件目录下的 plugin.yml 并校验
 */
@RequiredArgsConstructor
public class PluginManifestLoader {

    public static final String MANIFEST_FILE = "plugin.yml";

    private final ManifestValidator validator;

    public PluginManifest load(Path pluginDir) {
        Path file = pluginDir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(file)) {
            throw new ValidationException("Manifest not found: " + file);
        }
        Map<String, Object> raw;
        try {
            raw = YamlDescriptors.read(file);
        } catch (YAMLException | IllegalArgumentException e) {
            throw new ValidationException("Malformed manifest " + file + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new PlugBoxException(ErrorKind.IO, "Failed to read manifest " + file, e);
        }
        return validator.validate(raw);
    }

    public void write(Path pluginDir, PluginManifest manifest) throws IOException {
        YamlDescriptors.write(pluginDir.resolve(MANIFEST_FILE), ManifestWriter.toMap(manifest));
    }
}
