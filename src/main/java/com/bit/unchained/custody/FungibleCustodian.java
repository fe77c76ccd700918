package com.bit.unchained.custody;

import com.bit.unchained.common.Address;

import java.math.BigInteger;

/**
 * 同质化代币账本（外部托管方），调用同步且可能失败
 */
public interface FungibleCustodian {

    Address address();

    /**
     * 由引擎发起，从持有人处划转到接收方（质押转入）
     */
    void transferFrom(Address holder, Address recipient, BigInteger amount);

    /**
     * 由 sender 本人划转（引擎转出时 sender 为引擎地址）
     */
    void transfer(Address sender, Address recipient, BigInteger amount);

    BigInteger balanceOf(Address holder);
}
