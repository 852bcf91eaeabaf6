package com.plugbox.core.spi;

/**
 * 插件包安全验证 SPI
 * 在解压之前执行，如签名校验。验证失败直接抛出异常，安装中止。
 */
public interface PluginPackageVerifier {

    void verify(String pluginId, String version, byte[] archive);
}
