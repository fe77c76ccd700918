package com.bit.unchained.structure.payload;

import com.bit.unchained.common.Address;
import com.bit.unchained.common.TopicKey;
import com.bit.unchained.structure.topic.TopicKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;

import static com.bit.unchained.signature.TypedDataEncoder.encodeAddress;
import static com.bit.unchained.signature.TypedDataEncoder.encodeIdArray;
import static com.bit.unchained.signature.TypedDataEncoder.encodeUint;
import static com.bit.unchained.signature.TypedDataEncoder.encodeUintArray;
import static com.bit.unchained.signature.TypedDataEncoder.hashStruct;
import static com.bit.unchained.signature.TypedDataEncoder.typeHash;

/**
 * NFT 价格批量更新载荷，nftIds 与 prices 按下标一一对应
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceUpdatePayload implements VotePayload {

    public static final String TYPE =
            "EIP712SetNftPrices(address requester,uint256[] nftIds,uint256[] prices,uint256 nonce)";
    public static final String KEY_TYPE =
            "EIP712SetNftPricesKey(uint256[] nftIds,uint256[] prices,uint256 nonce)";

    private static final byte[] TYPE_HASH = typeHash(TYPE);
    private static final byte[] KEY_TYPE_HASH = typeHash(KEY_TYPE);

    private Address requester;
    private List<Long> nftIds;
    private List<BigInteger> prices;
    private BigInteger nonce;

    @Override
    public TopicKind kind() {
        return TopicKind.PRICE_UPDATE;
    }

    @Override
    public Address declaredSigner() {
        return requester;
    }

    @Override
    public byte[] structHash() {
        return hashStruct(TYPE_HASH,
                encodeAddress(requester),
                encodeIdArray(nftIds),
                encodeUintArray(prices),
                encodeUint(nonce));
    }

    @Override
    public TopicKey topicKey() {
        return TopicKey.fromBytes(hashStruct(KEY_TYPE_HASH,
                encodeIdArray(nftIds),
                encodeUintArray(prices),
                encodeUint(nonce)));
    }

    @Override
    public void validate() {
        PayloadChecks.notNull(requester, "requester");
        PayloadChecks.idList(nftIds, "nftIds");
        PayloadChecks.uint256List(prices, "prices");
        PayloadChecks.uint256(nonce, "nonce");
    }
}
