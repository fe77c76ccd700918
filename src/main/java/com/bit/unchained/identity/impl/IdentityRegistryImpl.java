package com.bit.unchained.identity.impl;

import com.bit.unchained.common.Address;
import com.bit.unchained.error.ErrorType;
import com.bit.unchained.error.StakingException;
import com.bit.unchained.gate.JournaledMap;
import com.bit.unchained.gate.NonReentrantGate;
import com.bit.unchained.identity.IdentityRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class IdentityRegistryImpl implements IdentityRegistry {

    // 质押者 -> 代理签名者
    private final JournaledMap<Address, Address> delegates;
    // 代理签名者 -> 质押者
    private final JournaledMap<Address, Address> delegators;
    // 质押者 -> 备用地址
    private final JournaledMap<Address, Address> alternates;
    // 备用地址 -> 质押者
    private final JournaledMap<Address, Address> alternateOwners;

    public IdentityRegistryImpl(NonReentrantGate gate) {
        this.delegates = new JournaledMap<>(gate);
        this.delegators = new JournaledMap<>(gate);
        this.alternates = new JournaledMap<>(gate);
        this.alternateOwners = new JournaledMap<>(gate);
    }

    @Override
    public void setDelegate(Address staker, Address signer) {
        Address owner = delegators.get(signer);
        if (owner != null && !owner.equals(staker)) {
            throw new StakingException(ErrorType.DELEGATE_ADDRESS_IN_USE, signer + " 已代理 " + owner);
        }
        Address previous = delegates.put(staker, signer);
        if (previous != null && !previous.equals(signer)) {
            delegators.remove(previous);
        }
        delegators.put(signer, staker);
        log.info("质押者 {} 绑定代理签名者 {}（原代理: {}）", staker, signer, previous);
    }

    @Override
    public Address delegateOf(Address staker) {
        return delegates.get(staker);
    }

    @Override
    public Address stakerOfDelegate(Address signer) {
        return delegators.get(signer);
    }

    @Override
    public void bindAlternate(Address staker, Address alternate) {
        Address owner = alternateOwners.get(alternate);
        if (owner != null && !owner.equals(staker)) {
            throw new StakingException(ErrorType.ADDRESS_IN_USE, alternate + " 已绑定 " + owner);
        }
        Address previous = alternates.put(staker, alternate);
        if (previous != null && !previous.equals(alternate)) {
            alternateOwners.remove(previous);
        }
        alternateOwners.put(alternate, staker);
        log.info("质押者 {} 绑定备用地址 {}", staker, alternate);
    }

    @Override
    public Address alternateOf(Address staker) {
        return alternates.get(staker);
    }

    @Override
    public Address stakerOfAlternate(Address alternate) {
        return alternateOwners.get(alternate);
    }
}
