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
 * 资产转移载荷：from 为引擎地址时从资金池划出，to 为惩罚收款方时即罚没
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferPayload implements VotePayload {

    public static final String TYPE =
            "EIP712Transfer(address signer,address from,address to,uint256 amount,uint256[] nftIds,uint256[] nonces)";
    public static final String KEY_TYPE =
            "EIP712TransferKey(address from,address to,uint256 amount,uint256[] nftIds,uint256[] nonces)";

    private static final byte[] TYPE_HASH = typeHash(TYPE);
    private static final byte[] KEY_TYPE_HASH = typeHash(KEY_TYPE);

    private Address signer;
    private Address from;
    private Address to;
    private BigInteger amount;
    private List<Long> nftIds;
    private List<BigInteger> nonces;

    @Override
    public TopicKind kind() {
        return TopicKind.TRANSFER;
    }

    @Override
    public Address declaredSigner() {
        return signer;
    }

    @Override
    public byte[] structHash() {
        return hashStruct(TYPE_HASH,
                encodeAddress(signer),
                encodeAddress(from),
                encodeAddress(to),
                encodeUint(amount),
                encodeIdArray(nftIds),
                encodeUintArray(nonces));
    }

    @Override
    public TopicKey topicKey() {
        return TopicKey.fromBytes(hashStruct(KEY_TYPE_HASH,
                encodeAddress(from),
                encodeAddress(to),
                encodeUint(amount),
                encodeIdArray(nftIds),
                encodeUintArray(nonces)));
    }

    @Override
    public void validate() {
        PayloadChecks.notNull(signer, "signer");
        PayloadChecks.notNull(from, "from");
        PayloadChecks.notNull(to, "to");
        PayloadChecks.uint256(amount, "amount");
        PayloadChecks.idList(nftIds, "nftIds");
        PayloadChecks.uint256List(nonces, "nonces");
    }
}
