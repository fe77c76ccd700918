package com.bit.unchained.api.dto;

import com.bit.unchained.structure.sig.Signature;
import lombok.Data;

import java.util.List;

/**
 * 中继方提交的投票批次，payloads 与 signatures 按下标一一对应
 */
@Data
public class VoteBatch<P> {
    private List<P> payloads;
    private List<Signature> signatures;
}
