package com.bit.unchained.nonce;

import com.bit.unchained.common.Address;

import java.math.BigInteger;
import java.util.List;

/**
 * 防重放：已消费的 (身份, nonce) 集合只增不减
 */
public interface ReplayGuard {

    boolean isUsed(Address owner, BigInteger nonce);

    /**
     * 任一nonce已被消费则抛出 NONCE_USED(row, nonce)
     */
    void checkUnused(int row, Address owner, List<BigInteger> nonces);

    /**
     * 消费全部nonce（需在门控内调用），重复消费抛出 NONCE_USED(row, nonce)
     */
    void consume(int row, Address owner, List<BigInteger> nonces);

    int usedCount();
}
