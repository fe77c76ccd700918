package com.bit.unchained.util;

import com.bit.unchained.common.Address;
import com.bit.unchained.structure.sig.Signature;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.security.Security;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * secp256k1 可恢复签名工具
 * 签名对象是32字节摘要（调用方负责按类型化数据规则计算），签名格式为 r||s||v
 */
@Slf4j
public class Secp256k1Signer {

    // ------------------------------ 常量定义 ------------------------------
    public static final int PRIVATE_KEY_CORE_LENGTH = 32;
    public static final int DIGEST_LENGTH = 32;
    private static final int RECOVERY_ID_OFFSET = 27;
    private static final BigInteger CURVE_ORDER = ECKey.CURVE.getN();

    // ------------------------------ 恢复结果缓存（提升重复任务性能） ------------------------------
    // key=摘要Hex:签名Hex，value=恢复出的地址（恢复失败为Optional.empty）
    private static final Cache<String, Optional<Address>> RECOVERY_CACHE;

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
        RECOVERY_CACHE = Caffeine.newBuilder()
                .maximumSize(100_000)
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .recordStats()
                .build();
    }

    // ------------------------------ 基础密钥操作 ------------------------------

    /**
     * 由32字节核心私钥构造密钥
     */
    public static ECKey keyFromPrivate(byte[] privateKey) {
        if (privateKey == null || privateKey.length != PRIVATE_KEY_CORE_LENGTH) {
            throw new IllegalArgumentException("私钥必须为32字节");
        }
        return ECKey.fromPrivate(privateKey);
    }

    /**
     * 公钥推导地址：keccak256(非压缩公钥去掉0x04前缀) 的后20字节
     */
    public static Address addressOf(ECKey key) {
        byte[] uncompressed = key.getPubKeyPoint().getEncoded(false);
        byte[] hash = Sha.applyKeccak256(Arrays.copyOfRange(uncompressed, 1, uncompressed.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    // ------------------------------ 签名/恢复 ------------------------------

    /**
     * 对32字节摘要签名（RFC6979确定性k，低s规范化）
     * @return 65字节可恢复签名
     */
    public static Signature signDigest(ECKey key, byte[] digest) {
        checkDigest(digest);
        Sha256Hash hash = Sha256Hash.wrap(digest);
        ECKey.ECDSASignature sig = key.sign(hash);
        byte[] expected = key.getPubKeyPoint().getEncoded(false);
        for (int recId = 0; recId < 4; recId++) {
            ECKey recovered = ECKey.recoverFromSignature(recId, sig, hash, false);
            if (recovered != null && Arrays.equals(recovered.getPubKeyPoint().getEncoded(false), expected)) {
                return Signature.of(sig.r, sig.s, RECOVERY_ID_OFFSET + recId);
            }
        }
        throw new IllegalStateException("无法计算签名恢复标识");
    }

    /**
     * 从摘要和签名恢复签名者地址
     * @return 签名不合法（v非法、高s、r/s越界、无法恢复）时返回empty
     */
    public static Optional<Address> recoverAddress(byte[] digest, Signature signature) {
        checkDigest(digest);
        String cacheKey = Hex.toHexString(digest) + ":" + signature.toHex();
        return RECOVERY_CACHE.get(cacheKey, k -> doRecover(digest, signature));
    }

    /**
     * 获取缓存统计信息（用于监控命中率）
     */
    public static String getCacheStats() {
        CacheStats stats = RECOVERY_CACHE.stats();
        return String.format(
                "签名恢复缓存统计：命中率=%.2f%%, 总请求数=%d, 命中数=%d, 未命中数=%d",
                stats.hitRate() * 100,
                stats.requestCount(),
                stats.hitCount(),
                stats.missCount()
        );
    }

    private static Optional<Address> doRecover(byte[] digest, Signature signature) {
        int v = signature.getV();
        if (v != RECOVERY_ID_OFFSET && v != RECOVERY_ID_OFFSET + 1) {
            return Optional.empty();
        }
        BigInteger r = signature.getR();
        BigInteger s = signature.getS();
        if (r.signum() == 0 || s.signum() == 0 || r.compareTo(CURVE_ORDER) >= 0 || s.compareTo(CURVE_ORDER) >= 0) {
            return Optional.empty();
        }
        ECKey.ECDSASignature sig = new ECKey.ECDSASignature(r, s);
        // 高s签名可被篡改为另一个合法签名，拒绝
        if (!sig.isCanonical()) {
            return Optional.empty();
        }
        try {
            ECKey key = ECKey.recoverFromSignature(v - RECOVERY_ID_OFFSET, sig, Sha256Hash.wrap(digest), false);
            return key == null ? Optional.empty() : Optional.of(addressOf(key));
        } catch (IllegalArgumentException e) {
            log.debug("签名恢复失败: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static void checkDigest(byte[] digest) {
        if (digest == null || digest.length != DIGEST_LENGTH) {
            throw new IllegalArgumentException("摘要必须为32字节");
        }
    }
}
