package com.bit.unchained.voting;

import com.bit.unchained.common.Address;
import com.bit.unchained.common.TopicKey;
import com.bit.unchained.structure.params.GlobalParams;
import com.bit.unchained.structure.payload.ParamsPayload;
import com.bit.unchained.structure.payload.PriceUpdatePayload;
import com.bit.unchained.structure.payload.SignerPayload;
import com.bit.unchained.structure.payload.TransferPayload;
import com.bit.unchained.structure.payload.VotePayload;
import com.bit.unchained.structure.sig.Signature;
import com.bit.unchained.structure.topic.TopicRecord;

import java.math.BigInteger;
import java.util.List;

/**
 * 共识引擎：批量提交签名投票，议题达到质押加权阈值后执行效果
 * 批次按数组顺序单遍处理，任一行失败整批回滚；批量方法返回每行处理后的议题状态
 */
public interface VotingService {

    List<TopicRecord> transfer(List<TransferPayload> payloads, List<Signature> signatures);

    List<TopicRecord> setParams(List<ParamsPayload> payloads, List<Signature> signatures);

    List<TopicRecord> setNftPrices(List<PriceUpdatePayload> payloads, List<Signature> signatures);

    /**
     * 代理签名握手：质押者与签名者双方签名，立即生效，不经投票
     */
    void setSigner(SignerPayload payload, Signature stakerSignature, Signature signerSignature);

    void setAlternateAddress(Address staker, Address alternate);

    // ------------------------------ 查询 ------------------------------

    TopicRecord getTopic(VotePayload payload);

    TopicRecord getTopic(TopicKey key);

    boolean hasVoted(VotePayload payload, Address identity);

    GlobalParams getParams();

    /**
     * 当前通过所需的投票权 = 总投票权 * 阈值 / 100（向下取整）
     */
    BigInteger getConsensusThreshold();

    Address delegateOf(Address staker);

    Address stakerOfDelegate(Address signer);
}
