package com.bit.unchained.api.dto;

import com.bit.unchained.structure.payload.SignerPayload;
import com.bit.unchained.structure.sig.Signature;
import lombok.Data;

@Data
public class SignerHandshake {
    private SignerPayload payload;
    private Signature stakerSignature;
    private Signature signerSignature;
}
