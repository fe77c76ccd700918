package com.bit.unchained.signature;

import com.bit.unchained.common.Address;
import com.bit.unchained.structure.payload.VotePayload;
import com.bit.unchained.structure.sig.Signature;

import java.util.Optional;

public interface SignatureVerifier {

    /**
     * 从结构哈希（套上签名域）和签名恢复签名者
     */
    Optional<Address> recover(byte[] structHash, Signature signature);

    boolean isSignedBy(byte[] structHash, Signature signature, Address expected);

    /**
     * 解析有效投票者：恢复出的地址等于载荷声明的签名者，或是其登记的代理签名者
     * @return 有效时返回声明的签名者（质押身份）
     */
    Optional<Address> resolveVoter(VotePayload payload, Signature signature);
}
