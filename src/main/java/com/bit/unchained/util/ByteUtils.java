package com.bit.unchained.util;

import java.math.BigInteger;

public class ByteUtils {

    private static final BigInteger UINT256_MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    /**
     * 字节数组转十六进制字符串（小写，无前缀）
     */
    public static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    /**
     * 十六进制字符串转字节数组（允许0x前缀）
     */
    public static byte[] hexToBytes(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("十六进制字符串不能为空");
        }
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        int len = hex.length();
        if (len % 2 != 0) {
            throw new IllegalArgumentException("十六进制字符串长度必须为偶数: " + hex);
        }
        byte[] data = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int high = Character.digit(hex.charAt(i), 16);
            int low = Character.digit(hex.charAt(i + 1), 16);
            if (high == -1 || low == -1) {
                throw new IllegalArgumentException("非法十六进制字符: " + hex);
            }
            data[i / 2] = (byte) ((high << 4) | low);
        }
        return data;
    }

    /**
     * uint256 大端编码，固定32字节
     */
    public static byte[] uint256(BigInteger value) {
        if (value == null || value.signum() < 0 || value.compareTo(UINT256_MAX) > 0) {
            throw new IllegalArgumentException("数值超出uint256范围: " + value);
        }
        byte[] raw = value.toByteArray();
        byte[] out = new byte[32];
        // toByteArray 可能带一个符号位前导0
        int copy = Math.min(raw.length, 32);
        System.arraycopy(raw, raw.length - copy, out, 32 - copy, copy);
        return out;
    }

    public static byte[] uint256(long value) {
        return uint256(BigInteger.valueOf(value));
    }

    /**
     * 左侧补0到32字节（地址等短字段的ABI编码）
     */
    public static byte[] leftPad32(byte[] value) {
        if (value.length > 32) {
            throw new IllegalArgumentException("字段超过32字节");
        }
        byte[] out = new byte[32];
        System.arraycopy(value, 0, out, 32 - value.length, value.length);
        return out;
    }

    public static byte[] concat(byte[]... parts) {
        int total = 0;
        for (byte[] part : parts) {
            total += part.length;
        }
        byte[] combined = new byte[total];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, combined, offset, part.length);
            offset += part.length;
        }
        return combined;
    }
}
