package com.bit.unchained.common;

import com.bit.unchained.util.ByteUtils;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 身份地址封装（20字节），统一质押者/签名者/托管方的地址表示
 * 由secp256k1公钥的keccak256哈希取后20字节得到
 */
@EqualsAndHashCode
public final class Address implements Serializable {
    public static final int LENGTH = 20;
    public static final Address ZERO = new Address(new byte[LENGTH]);

    private final byte[] value;

    private Address(byte[] value) {
        if (value == null || value.length != LENGTH) {
            throw new IllegalArgumentException("地址必须为20字节");
        }
        this.value = value;
    }

    public static Address fromBytes(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("地址必须为20字节");
        }
        return new Address(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * 从十六进制字符串解析地址（可带0x前缀，大小写均可）
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Address fromHex(String hex) {
        return new Address(ByteUtils.hexToBytes(hex));
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    public boolean isZero() {
        return equals(ZERO);
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
