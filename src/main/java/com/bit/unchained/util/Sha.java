package com.bit.unchained.util;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.MessageDigest;
import java.security.Security;

@Slf4j
public class Sha {

    // Keccak-256（以太坊风格，非SHA3-256）每个线程独立实例
    private static final ThreadLocal<MessageDigest> KECCAK256_THREAD_LOCAL = ThreadLocal.withInitial(Keccak.Digest256::new);

    // 静态代码块：确保BouncyCastle先注册
    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
        try {
            // 提前触发ThreadLocal初始化（预热）
            KECCAK256_THREAD_LOCAL.get();
        } catch (Exception e) {
            throw new RuntimeException("哈希算法初始化验证失败：" + e.getMessage()
                    + "，请确保BouncyCastle依赖正确（建议版本1.68+）", e);
        }
    }

    /**
     * 线程安全的Keccak-256计算，签名摘要与地址推导都基于它
     */
    public static byte[] applyKeccak256(byte[] data) {
        data = data == null ? new byte[0] : data;
        MessageDigest digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(data);
    }

    /**
     * 多段数据拼接后计算Keccak-256，避免额外拷贝
     */
    public static byte[] applyKeccak256(byte[]... parts) {
        MessageDigest digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        for (byte[] part : parts) {
            digest.update(part);
        }
        return digest.digest();
    }
}
