package com.bit.unchained.nonce;

import com.bit.unchained.common.Address;
import lombok.Value;

import java.math.BigInteger;

@Value
public class NonceSlot {
    Address owner;
    BigInteger nonce;
}
