package com.bit.unchained.structure.sig;

import com.bit.unchained.util.ByteUtils;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * 可恢复的secp256k1签名（65字节：r(32) + s(32) + v(1)）
 * v 取 27/28，可从摘要和签名恢复出签名者公钥
 */
@EqualsAndHashCode
public final class Signature {
    public static final int LENGTH = 65;

    private final byte[] value;

    private Signature(byte[] value) {
        if (value == null || value.length != LENGTH) {
            throw new IllegalArgumentException("签名必须为65字节");
        }
        this.value = value;
    }

    public static Signature fromBytes(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("签名必须为65字节");
        }
        return new Signature(Arrays.copyOf(bytes, bytes.length));
    }

    public static Signature of(BigInteger r, BigInteger s, int v) {
        return new Signature(ByteUtils.concat(ByteUtils.uint256(r), ByteUtils.uint256(s), new byte[]{(byte) v}));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Signature fromHex(String hex) {
        return new Signature(ByteUtils.hexToBytes(hex));
    }

    public BigInteger getR() {
        return new BigInteger(1, Arrays.copyOfRange(value, 0, 32));
    }

    public BigInteger getS() {
        return new BigInteger(1, Arrays.copyOfRange(value, 32, 64));
    }

    public int getV() {
        return value[64] & 0xFF;
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    @JsonValue
    public String toHex() {
        return "0x" + ByteUtils.bytesToHex(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
