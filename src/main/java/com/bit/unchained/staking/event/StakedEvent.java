package com.bit.unchained.staking.event;

import com.bit.unchained.common.Address;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * 新建或追加质押成功，amount/nftIds 为本次转入的部分
 */
@Value
public class StakedEvent {
    Address staker;
    long unlockTime;
    BigInteger amount;
    List<Long> nftIds;
}
