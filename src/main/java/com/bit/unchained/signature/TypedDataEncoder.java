package com.bit.unchained.signature;

import com.bit.unchained.common.Address;
import com.bit.unchained.util.ByteUtils;
import com.bit.unchained.util.Sha;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 类型化结构化数据编码（EIP-712 布局）
 * 静态字段按32字节槽编码；string 与动态数组编码为其内容的 keccak256
 */
public final class TypedDataEncoder {

    public static final String DOMAIN_TYPE =
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";

    private static final byte[] DIGEST_PREFIX = new byte[]{0x19, 0x01};

    private TypedDataEncoder() {
    }

    public static byte[] typeHash(String typeString) {
        return Sha.applyKeccak256(typeString.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] encodeAddress(Address address) {
        return ByteUtils.leftPad32(address.toBytes());
    }

    public static byte[] encodeUint(BigInteger value) {
        return ByteUtils.uint256(value);
    }

    public static byte[] encodeUint(long value) {
        return ByteUtils.uint256(value);
    }

    public static byte[] encodeString(String value) {
        return Sha.applyKeccak256(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * uint256[]：各元素32字节拼接后取哈希
     */
    public static byte[] encodeUintArray(List<BigInteger> values) {
        byte[][] slots = new byte[values.size()][];
        for (int i = 0; i < values.size(); i++) {
            slots[i] = ByteUtils.uint256(values.get(i));
        }
        return Sha.applyKeccak256(slots);
    }

    public static byte[] encodeIdArray(List<Long> ids) {
        byte[][] slots = new byte[ids.size()][];
        for (int i = 0; i < ids.size(); i++) {
            slots[i] = ByteUtils.uint256(ids.get(i));
        }
        return Sha.applyKeccak256(slots);
    }

    /**
     * hashStruct = keccak256(typeHash ‖ encodeData)
     */
    public static byte[] hashStruct(byte[] typeHash, byte[]... encodedFields) {
        byte[][] parts = new byte[encodedFields.length + 1][];
        parts[0] = typeHash;
        System.arraycopy(encodedFields, 0, parts, 1, encodedFields.length);
        return Sha.applyKeccak256(parts);
    }

    public static byte[] domainSeparator(String name, String version, long chainId, Address verifyingContract) {
        return hashStruct(typeHash(DOMAIN_TYPE),
                encodeString(name),
                encodeString(version),
                encodeUint(chainId),
                encodeAddress(verifyingContract));
    }

    /**
     * 待签名摘要 = keccak256(0x19 0x01 ‖ domainSeparator ‖ structHash)
     */
    public static byte[] digest(byte[] domainSeparator, byte[] structHash) {
        return Sha.applyKeccak256(DIGEST_PREFIX, domainSeparator, structHash);
    }
}
