package com.bit.unchained.custody;

import com.bit.unchained.common.Address;
import com.bit.unchained.error.StakingException;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 托管方目录：按地址解析全局参数中引用的代币账本/NFT登记表/价格预言机
 * 参数变更只能切换到目录中已知的托管方
 */
public class CustodianDirectory {

    private final Map<Address, FungibleCustodian> fungibles = new ConcurrentHashMap<>();
    private final Map<Address, NftCustodian> nfts = new ConcurrentHashMap<>();
    private final Map<Address, PriceOracle> oracles = new ConcurrentHashMap<>();

    public CustodianDirectory register(FungibleCustodian custodian) {
        fungibles.put(custodian.address(), custodian);
        return this;
    }

    public CustodianDirectory register(NftCustodian custodian) {
        nfts.put(custodian.address(), custodian);
        return this;
    }

    public CustodianDirectory register(PriceOracle oracle) {
        oracles.put(oracle.address(), oracle);
        return this;
    }

    public boolean isFungible(Address address) {
        return address != null && fungibles.containsKey(address);
    }

    public boolean isNft(Address address) {
        return address != null && nfts.containsKey(address);
    }

    public boolean isOracle(Address address) {
        return address != null && oracles.containsKey(address);
    }

    public FungibleCustodian fungible(Address address) {
        FungibleCustodian custodian = fungibles.get(address);
        if (custodian == null) {
            throw StakingException.forbidden("未知的代币账本: " + address);
        }
        return custodian;
    }

    public NftCustodian nft(Address address) {
        NftCustodian custodian = nfts.get(address);
        if (custodian == null) {
            throw StakingException.forbidden("未知的NFT登记表: " + address);
        }
        return custodian;
    }

    public PriceOracle oracle(Address address) {
        PriceOracle oracle = oracles.get(address);
        if (oracle == null) {
            throw StakingException.forbidden("未知的价格预言机: " + address);
        }
        return oracle;
    }

    public Collection<NftCustodian> nftCustodians() {
        return Collections.unmodifiableCollection(nfts.values());
    }
}
