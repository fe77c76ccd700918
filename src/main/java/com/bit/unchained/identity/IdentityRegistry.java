package com.bit.unchained.identity;

import com.bit.unchained.common.Address;

/**
 * 身份登记：质押者 ↔ 代理签名者、质押者 ↔ 备用地址，两组映射都是双向单射
 * 写操作需在门控内调用
 */
public interface IdentityRegistry {

    /**
     * 绑定代理签名者，替换质押者原有代理
     * @throws com.bit.unchained.error.StakingException DELEGATE_ADDRESS_IN_USE 签名者已代理其他质押者
     */
    void setDelegate(Address staker, Address signer);

    /**
     * @return 未绑定返回null
     */
    Address delegateOf(Address staker);

    Address stakerOfDelegate(Address signer);

    /**
     * 绑定备用签名地址（BLS等）
     * @throws com.bit.unchained.error.StakingException ADDRESS_IN_USE 备用地址已绑定其他质押者
     */
    void bindAlternate(Address staker, Address alternate);

    Address alternateOf(Address staker);

    Address stakerOfAlternate(Address alternate);
}
