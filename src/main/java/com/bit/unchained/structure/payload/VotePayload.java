package com.bit.unchained.structure.payload;

import com.bit.unchained.common.Address;
import com.bit.unchained.common.TopicKey;
import com.bit.unchained.structure.topic.TopicKind;

/**
 * 可投票的签名载荷
 * structHash 覆盖全部字段（含签名者），topicKey 覆盖除签名者外的字段，
 * 不同投票者对同一内容的签名收敛到同一议题
 */
public interface VotePayload {

    TopicKind kind();

    /**
     * 载荷中声明的签名者（质押者身份）
     */
    Address declaredSigner();

    byte[] structHash();

    TopicKey topicKey();

    /**
     * 字段合法性校验（空值、负数、超出uint256），不合法抛出 FORBIDDEN
     */
    void validate();
}
