package com.plugbox.core.spi;

import java.util.Map;

/**
 * 出站网络 SPI
 * 域名白名单已由权限闸门检查，实现只负责发送。
 */
public interface NetworkGateway {

    Map<String, Object> fetch(String url, Map<String, Object> options);
}
