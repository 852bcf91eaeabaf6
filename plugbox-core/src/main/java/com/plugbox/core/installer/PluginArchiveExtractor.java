package com.plugbox.core.installer;

import com.plugbox.api.exception.ErrorKind;
import com.plugbox.api.exception.PathTraversalException;
import com.plugbox.api.exception.PlugBoxException;
import com.plugbox.api.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * 插件包 (zip) 解压
 * 每个条目都规范化后检查是否仍在目标目录内，越界条目 (zip-slip) 直接中止整个解压。
 */
@Slf4j
public class PluginArchiveExtractor {

    /**
     * 解压到 targetDir（不存在时创建）
     *
     * @return 解压出的文件数
     */
    public int extract(byte[] archive, Path targetDir) {
        Path root = targetDir.toAbsolutePath().normalize();
        int files = 0;
        try {
            Files.createDirectories(root);
            try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
                ZipEntry entry;
                while ((entry = zip.getNextEntry()) != null) {
                    Path target = root.resolve(entry.getName()).normalize();
                    if (!target.startsWith(root) || target.equals(root)) {
                        throw new PathTraversalException("Archive entry escapes plugin directory: " + entry.getName());
                    }
                    if (entry.isDirectory()) {
                        Files.createDirectories(target);
                    } else {
                        Files.createDirectories(target.getParent());
                        Files.copy(zip, target);
                        files++;
                    }
                    zip.closeEntry();
                }
            }
        } catch (ZipException e) {
            throw new ValidationException("Corrupt plugin package: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new PlugBoxException(ErrorKind.IO, "Failed to extract plugin package into " + root, e);
        }
        if (files == 0) {
            throw new ValidationException("Plugin package is empty or not a zip archive");
        }
        log.debug("Extracted {} file(s) into {}", files, root);
        return files;
    }
}
