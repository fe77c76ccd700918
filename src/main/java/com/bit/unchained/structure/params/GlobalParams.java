package com.bit.unchained.structure.params;

import com.bit.unchained.common.Address;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * 全局参数（不可变、带版本），只能由通过的参数变更议题整体替换
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
public class GlobalParams {

    // 代币账本地址
    Address token;
    // NFT登记表地址
    Address nft;
    // NFT价格预言机地址
    Address nftTracker;
    // 通过阈值百分比 1..100
    int threshold;
    // 议题有效期（秒）
    long expiration;
    // 惩罚收款方
    Address collector;
    long version;
}
