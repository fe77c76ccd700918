package com.bit.unchained.staking.event;

import com.bit.unchained.common.Address;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

@Value
public class UnStakedEvent {
    Address staker;
    BigInteger amount;
    List<Long> nftIds;
}
