package com.plugbox.core.security;

import com.plugbox.api.exception.PathTraversalException;
import com.plugbox.api.exception.ValidationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 把插件传入的路径规范化到插件目录内
 * <p>
 * 先词法规范化再检查前缀；目标（或其最近的已存在祖先）存在时再用真实路径复查，
 * 防止借符号链接逃逸。
 * </p>
 */
public class SandboxPathResolver {

    private final Path root;

    public SandboxPathResolver(Path pluginDir) {
        Path absolute = pluginDir.toAbsolutePath().normalize();
        Path real;
        try {
            real = absolute.toRealPath();
        } catch (IOException e) {
            real = absolute;
        }
        this.root = real;
    }

    public Path getRoot() {
        return root;
    }

    /**
     * @return 插件目录内的绝对路径
     * @throws PathTraversalException 路径逃逸出插件目录
     */
    public Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new ValidationException("Path must not be empty");
        }
        Path candidate;
        try {
            candidate = root.resolve(path).normalize();
        } catch (java.nio.file.InvalidPathException e) {
            throw new ValidationException("Invalid path: " + path, e);
        }
        if (!candidate.startsWith(root) || candidate.equals(root)) {
            throw new PathTraversalException("Path escapes plugin directory: " + path);
        }

        Path existing = candidate;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing != null) {
            try {
                Path real = existing.toRealPath();
                if (!real.startsWith(root)) {
                    throw new PathTraversalException("Path escapes plugin directory: " + path);
                }
            } catch (IOException e) {
                throw new PathTraversalException("Cannot resolve path: " + path, e);
            }
        }
        return candidate;
    }

    /**
     * 相对插件目录的路径，用于 glob 匹配
     */
    public Path relativize(Path resolved) {
        return root.relativize(resolved);
    }
}
