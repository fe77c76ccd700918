package com.bit.unchained.custody.memory;

import com.bit.unchained.common.Address;
import com.bit.unchained.custody.PriceOracle;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class MemoryPriceOracle implements PriceOracle {

    private final Address address;
    private final Map<Long, BigInteger> prices = new ConcurrentHashMap<>();

    public MemoryPriceOracle(Address address) {
        this.address = address;
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public BigInteger getPrice(long id) {
        return prices.getOrDefault(id, BigInteger.ZERO);
    }

    @Override
    public void setPrice(long id, BigInteger price) {
        prices.put(id, price);
    }
}
