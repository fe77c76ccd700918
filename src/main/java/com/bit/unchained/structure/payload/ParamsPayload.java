package com.bit.unchained.structure.payload;

import com.bit.unchained.common.Address;
import com.bit.unchained.common.TopicKey;
import com.bit.unchained.structure.topic.TopicKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

import static com.bit.unchained.signature.TypedDataEncoder.encodeAddress;
import static com.bit.unchained.signature.TypedDataEncoder.encodeUint;
import static com.bit.unchained.signature.TypedDataEncoder.hashStruct;
import static com.bit.unchained.signature.TypedDataEncoder.typeHash;

/**
 * 全局参数变更载荷，nonce 只用于区分内容相同的多次变更
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParamsPayload implements VotePayload {

    public static final String TYPE =
            "EIP712SetParams(address requester,address token,address nft,address nftTracker,uint256 threshold,uint256 expiration,address collector,uint256 nonce)";
    public static final String KEY_TYPE =
            "EIP712SetParamsKey(address token,address nft,address nftTracker,uint256 threshold,uint256 expiration,address collector,uint256 nonce)";

    private static final byte[] TYPE_HASH = typeHash(TYPE);
    private static final byte[] KEY_TYPE_HASH = typeHash(KEY_TYPE);

    private Address requester;
    private Address token;
    private Address nft;
    private Address nftTracker;
    private BigInteger threshold;
    private BigInteger expiration;
    private Address collector;
    private BigInteger nonce;

    @Override
    public TopicKind kind() {
        return TopicKind.PARAMS;
    }

    @Override
    public Address declaredSigner() {
        return requester;
    }

    @Override
    public byte[] structHash() {
        return hashStruct(TYPE_HASH,
                encodeAddress(requester),
                encodeAddress(token),
                encodeAddress(nft),
                encodeAddress(nftTracker),
                encodeUint(threshold),
                encodeUint(expiration),
                encodeAddress(collector),
                encodeUint(nonce));
    }

    @Override
    public TopicKey topicKey() {
        return TopicKey.fromBytes(hashStruct(KEY_TYPE_HASH,
                encodeAddress(token),
                encodeAddress(nft),
                encodeAddress(nftTracker),
                encodeUint(threshold),
                encodeUint(expiration),
                encodeAddress(collector),
                encodeUint(nonce)));
    }

    @Override
    public void validate() {
        PayloadChecks.notNull(requester, "requester");
        PayloadChecks.notNull(token, "token");
        PayloadChecks.notNull(nft, "nft");
        PayloadChecks.notNull(nftTracker, "nftTracker");
        PayloadChecks.uint256(threshold, "threshold");
        PayloadChecks.uint256(expiration, "expiration");
        PayloadChecks.notNull(collector, "collector");
        PayloadChecks.uint256(nonce, "nonce");
    }
}
