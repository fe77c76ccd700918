package com.bit.unchained.custody;

import com.bit.unchained.common.Address;

import java.math.BigInteger;

/**
 * NFT 价格预言机（价格跟踪器），全局参数 nftTracker 指向当前使用的实例
 */
public interface PriceOracle {

    Address address();

    BigInteger getPrice(long id);

    void setPrice(long id, BigInteger price);
}
