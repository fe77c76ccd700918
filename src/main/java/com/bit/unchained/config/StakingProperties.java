package com.bit.unchained.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 引擎构造期配置（application.yml 中 staking.*）
 * 地址均为0x开头的20字节十六进制
 */
@Data
@Component
@ConfigurationProperties(prefix = "staking")
public class StakingProperties {
    // 签名域
    private String name = "Unchained";
    private String version = "1";
    private long chainId = 1L;
    private String engineAddress;//引擎地址（资金池/NFT接收地址）

    private long activationTime = 0L;//激活时间（epoch秒），之前提交的投票一律拒绝

    // 初始全局参数
    private String token;//代币账本地址
    private String nft;//NFT登记表地址
    private String nftTracker;//NFT价格预言机地址
    private int threshold = 51;//通过阈值百分比
    private long expiration = 86400L;//议题有效期（秒）
    private String collector;//惩罚收款方
}
