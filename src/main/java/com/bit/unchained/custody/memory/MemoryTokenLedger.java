package com.bit.unchained.custody.memory;

import com.bit.unchained.common.Address;
import com.bit.unchained.custody.FungibleCustodian;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * 内存代币账本，本地运行与测试使用
 */
@Slf4j
public class MemoryTokenLedger implements FungibleCustodian {

    private final Address address;
    private final Map<Address, BigInteger> balances = new HashMap<>();

    public MemoryTokenLedger(Address address) {
        this.address = address;
    }

    @Override
    public Address address() {
        return address;
    }

    public synchronized void mint(Address holder, BigInteger amount) {
        balances.merge(holder, amount, BigInteger::add);
    }

    @Override
    public void transferFrom(Address holder, Address recipient, BigInteger amount) {
        move(holder, recipient, amount);
    }

    @Override
    public void transfer(Address sender, Address recipient, BigInteger amount) {
        move(sender, recipient, amount);
    }

    @Override
    public synchronized BigInteger balanceOf(Address holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    private synchronized void move(Address from, Address to, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("划转金额不能为负: " + amount);
        }
        BigInteger balance = balances.getOrDefault(from, BigInteger.ZERO);
        if (balance.compareTo(amount) < 0) {
            throw new IllegalStateException("余额不足: " + from + " 余额=" + balance + " 需要=" + amount);
        }
        balances.put(from, balance.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        log.debug("代币划转 {} -> {} 数量={}", from, to, amount);
    }
}
