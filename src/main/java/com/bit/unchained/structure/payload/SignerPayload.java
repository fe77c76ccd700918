package com.bit.unchained.structure.payload;

import com.bit.unchained.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import static com.bit.unchained.signature.TypedDataEncoder.encodeAddress;
import static com.bit.unchained.signature.TypedDataEncoder.hashStruct;
import static com.bit.unchained.signature.TypedDataEncoder.typeHash;

/**
 * 代理签名握手载荷：质押者与代理签名者各自对同一内容签名
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignerPayload {

    public static final String TYPE = "EIP712SetSigner(address staker,address signer)";

    private static final byte[] TYPE_HASH = typeHash(TYPE);

    private Address staker;
    private Address signer;

    public byte[] structHash() {
        return hashStruct(TYPE_HASH, encodeAddress(staker), encodeAddress(signer));
    }
}
