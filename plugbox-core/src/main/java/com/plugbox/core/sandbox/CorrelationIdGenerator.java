package com.plugbox.core.sandbox;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RPC 关联 ID 生成器
 * SHA-256(单调计数器 + 16 字节随机数 + nanoTime)，唯一且不可猜测。
 */
public final class CorrelationIdGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final AtomicLong counter = new AtomicLong();

    public String next() {
        byte[] nonce = new byte[16];
        RANDOM.nextBytes(nonce);
        ByteBuffer buffer = ByteBuffer.allocate(Long.BYTES * 2 + nonce.length);
        buffer.putLong(counter.incrementAndGet());
        buffer.put(nonce);
        buffer.putLong(System.nanoTime());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(buffer.array()));
        } catch (NoSuchAlgorithmException e) {
            // 每个 JRE 都必须提供 SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
