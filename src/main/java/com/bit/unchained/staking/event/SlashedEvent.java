package com.bit.unchained.staking.event;

import com.bit.unchained.common.Address;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * 转移议题通过后从质押者的质押中扣除资产
 */
@Value
public class SlashedEvent {
    Address staker;
    // 接收方，为引擎地址时资产留在资金池
    Address to;
    BigInteger amount;
    List<Long> nftIds;
}
