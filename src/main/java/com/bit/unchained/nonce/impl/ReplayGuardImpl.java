package com.bit.unchained.nonce.impl;

import com.bit.unchained.common.Address;
import com.bit.unchained.error.StakingException;
import com.bit.unchained.gate.JournaledSet;
import com.bit.unchained.gate.NonReentrantGate;
import com.bit.unchained.nonce.NonceSlot;
import com.bit.unchained.nonce.ReplayGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

@Slf4j
@Component
public class ReplayGuardImpl implements ReplayGuard {

    private final JournaledSet<NonceSlot> used;

    public ReplayGuardImpl(NonReentrantGate gate) {
        this.used = new JournaledSet<>(gate);
    }

    @Override
    public boolean isUsed(Address owner, BigInteger nonce) {
        return used.contains(new NonceSlot(owner, nonce));
    }

    @Override
    public void checkUnused(int row, Address owner, List<BigInteger> nonces) {
        for (BigInteger nonce : nonces) {
            if (isUsed(owner, nonce)) {
                throw StakingException.nonceUsed(row, nonce);
            }
        }
    }

    @Override
    public void consume(int row, Address owner, List<BigInteger> nonces) {
        for (BigInteger nonce : nonces) {
            if (!used.add(new NonceSlot(owner, nonce))) {
                throw StakingException.nonceUsed(row, nonce);
            }
        }
        log.debug("{} 消费nonce {}", owner, nonces);
    }

    @Override
    public int usedCount() {
        return used.size();
    }
}
