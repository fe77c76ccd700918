package com.bit.unchained.structure.topic;

import com.bit.unchained.common.Address;
import com.bit.unchained.common.TopicKey;
import com.bit.unchained.structure.payload.VotePayload;
import com.google.common.collect.ImmutableSet;
import lombok.Value;

import java.math.BigInteger;

/**
 * 议题记录（不可变）：首次投票时创建，之后只追加投票者，永不删除
 */
@Value
public class TopicRecord {

    TopicKind kind;
    TopicKey key;
    // 首次投票时间（epoch秒），过期判定的起点
    long firstSeen;
    BigInteger votedPower;
    boolean accepted;
    ImmutableSet<Address> voters;
    // 首个投票者提交的载荷
    VotePayload payload;

    public static TopicRecord open(TopicKey key, VotePayload payload, long firstSeen) {
        return new TopicRecord(payload.kind(), key, firstSeen, BigInteger.ZERO, false, ImmutableSet.of(), payload);
    }

    public boolean hasVoted(Address voter) {
        return voters.contains(voter);
    }

    public TopicRecord withVote(Address voter, BigInteger power) {
        ImmutableSet<Address> next = ImmutableSet.<Address>builder().addAll(voters).add(voter).build();
        return new TopicRecord(kind, key, firstSeen, votedPower.add(power), accepted, next, payload);
    }

    public TopicRecord accept() {
        return new TopicRecord(kind, key, firstSeen, votedPower, true, voters, payload);
    }

    /**
     * 最后可投票时间（含）
     */
    public long deadline(long expiration) {
        try {
            return Math.addExact(firstSeen, expiration);
        } catch (ArithmeticException e) {
            // 溢出按永不过期处理
            return Long.MAX_VALUE;
        }
    }
}
