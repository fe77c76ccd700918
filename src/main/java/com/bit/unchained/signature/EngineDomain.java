package com.bit.unchained.signature;

import com.bit.unchained.common.Address;
import lombok.Getter;

import java.util.Arrays;

/**
 * 签名域：绑定引擎名称、版本、链ID与引擎地址，防止跨部署重放
 */
@Getter
public class EngineDomain {

    private final String name;
    private final String version;
    private final long chainId;
    // 引擎自身地址（资金池地址、NFT接收地址）
    private final Address selfAddress;
    @Getter(lombok.AccessLevel.NONE)
    private final byte[] domainSeparator;

    public EngineDomain(String name, String version, long chainId, Address selfAddress) {
        this.name = name;
        this.version = version;
        this.chainId = chainId;
        this.selfAddress = selfAddress;
        this.domainSeparator = TypedDataEncoder.domainSeparator(name, version, chainId, selfAddress);
    }

    public byte[] getDomainSeparator() {
        return Arrays.copyOf(domainSeparator, domainSeparator.length);
    }

    public byte[] digest(byte[] structHash) {
        return TypedDataEncoder.digest(domainSeparator, structHash);
    }
}
