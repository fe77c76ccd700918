package com.bit.unchained.structure.stake;

import com.google.common.collect.ImmutableSet;
import lombok.Value;

import java.math.BigInteger;
import java.util.Collection;

/**
 * 质押记录（不可变），修改时整体替换
 * 有效质押：金额非零或至少抵押一个NFT
 */
@Value
public class Stake {

    public static final Stake EMPTY = new Stake(BigInteger.ZERO, 0L, ImmutableSet.of());

    BigInteger amount;
    // 解锁时间（epoch秒）
    long unlockTime;
    ImmutableSet<Long> nftIds;

    public boolean isActive() {
        return amount.signum() > 0 || !nftIds.isEmpty();
    }

    public Stake withAmount(BigInteger newAmount) {
        return new Stake(newAmount, unlockTime, nftIds);
    }

    public Stake withUnlockTime(long newUnlockTime) {
        return new Stake(amount, newUnlockTime, nftIds);
    }

    public Stake addNfts(Collection<Long> ids) {
        return new Stake(amount, unlockTime, ImmutableSet.<Long>builder().addAll(nftIds).addAll(ids).build());
    }

    public Stake removeNfts(Collection<Long> ids) {
        ImmutableSet.Builder<Long> builder = ImmutableSet.builder();
        for (Long id : nftIds) {
            if (!ids.contains(id)) {
                builder.add(id);
            }
        }
        return new Stake(amount, unlockTime, builder.build());
    }
}
