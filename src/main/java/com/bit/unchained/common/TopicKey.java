package com.bit.unchained.common;

import com.bit.unchained.util.ByteUtils;

/**
 * 主题键（32字节），由载荷去掉签名者字段后的结构哈希得到
 * 不同投票者对同一内容签名时收敛到同一个键
 */
public class TopicKey extends ByteHash32 {

    private TopicKey(byte[] value) {
        super(value);
    }

    public static TopicKey fromBytes(byte[] bytes) {
        return new TopicKey(bytes);
    }

    /**
     * 从十六进制字符串创建TopicKey实例（可带0x前缀）
     */
    public static TopicKey fromHex(String hex) {
        return new TopicKey(ByteUtils.hexToBytes(hex));
    }
}
