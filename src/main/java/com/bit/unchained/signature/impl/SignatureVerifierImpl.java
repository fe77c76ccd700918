package com.bit.unchained.signature.impl;

import com.bit.unchained.common.Address;
import com.bit.unchained.identity.IdentityRegistry;
import com.bit.unchained.signature.EngineDomain;
import com.bit.unchained.signature.SignatureVerifier;
import com.bit.unchained.structure.payload.VotePayload;
import com.bit.unchained.structure.sig.Signature;
import com.bit.unchained.util.Secp256k1Signer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
public class SignatureVerifierImpl implements SignatureVerifier {

    private final EngineDomain domain;
    private final IdentityRegistry identityRegistry;

    public SignatureVerifierImpl(EngineDomain domain, IdentityRegistry identityRegistry) {
        this.domain = domain;
        this.identityRegistry = identityRegistry;
    }

    @Override
    public Optional<Address> recover(byte[] structHash, Signature signature) {
        if (signature == null) {
            return Optional.empty();
        }
        return Secp256k1Signer.recoverAddress(domain.digest(structHash), signature);
    }

    @Override
    public boolean isSignedBy(byte[] structHash, Signature signature, Address expected) {
        return recover(structHash, signature).map(expected::equals).orElse(false);
    }

    @Override
    public Optional<Address> resolveVoter(VotePayload payload, Signature signature) {
        Address declared = payload.declaredSigner();
        Optional<Address> recovered = recover(payload.structHash(), signature);
        if (recovered.isEmpty()) {
            return Optional.empty();
        }
        Address candidate = recovered.get();
        if (candidate.equals(declared) || candidate.equals(identityRegistry.delegateOf(declared))) {
            return Optional.of(declared);
        }
        log.debug("签名者 {} 既不是 {} 也不是其代理", candidate, declared);
        return Optional.empty();
    }
}
