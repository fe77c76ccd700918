package com.bit.unchained.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PoolView {
    private BigInteger totalVotingPower;
    private BigInteger totalStakedAmount;
    private BigInteger freePoolBalance;
    private BigInteger consensusThreshold;
}
