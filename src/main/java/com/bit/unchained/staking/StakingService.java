package com.bit.unchained.staking;

import com.bit.unchained.common.Address;
import com.bit.unchained.structure.stake.Stake;

import java.math.BigInteger;
import java.util.List;

/**
 * 质押账本：质押生命周期、投票权资金池、NFT价格簿
 */
public interface StakingService {

    /**
     * 新建质押，锁定 duration 秒
     */
    Stake stake(Address caller, long duration, BigInteger amount, List<Long> nftIds);

    /**
     * 追加质押，不改变解锁时间
     */
    Stake increaseStake(Address caller, BigInteger amount, List<Long> nftIds);

    /**
     * 延长锁定：unlockTime += duration
     */
    Stake extend(Address caller, long duration);

    /**
     * 解锁后取回全部质押
     */
    void unstake(Address caller);

    /**
     * 找回误转入引擎的其他代币（调用方需具备管理权限），质押代币一律 FORBIDDEN
     */
    void recoverToken(Address token, Address to, BigInteger amount);

    // ------------------------------ 查询 ------------------------------

    /**
     * @return 无质押时返回 {@link Stake#EMPTY}
     */
    Stake getStake(Address staker);

    Stake getStakeByAlternate(Address alternate);

    /**
     * 投票权 = 质押金额 + 抵押NFT价格之和
     */
    BigInteger getVotingPower(Address staker);

    BigInteger getTotalVotingPower();

    BigInteger getTotalStakedAmount();

    BigInteger getNftPrice(long id);

    /**
     * 资金池中不属于任何质押的余额（可被池内转出议题动用）
     */
    BigInteger getFreePoolBalance();

    // ------------------------------ 议题效果使用（需在门控内调用） ------------------------------

    /**
     * 从质押者的质押中扣除金额和NFT（罚没/转出来源），不足则 FORBIDDEN
     * @param to 接收方，只用于罚没通知
     */
    void debit(Address from, Address to, BigInteger amount, List<Long> nftIds);

    /**
     * 从资金池转出给接收方；接收方为引擎自身时资金留在池中
     */
    void release(Address to, BigInteger amount, List<Long> nftIds);

    /**
     * 更新价格簿，已抵押的NFT按差价调整资金池，并同步到预言机
     */
    void applyPrices(List<Long> nftIds, List<BigInteger> prices);
}
