package com.bit.unchained.voting.impl;

import com.bit.unchained.common.Address;
import com.bit.unchained.common.TopicKey;
import com.bit.unchained.config.StakingProperties;
import com.bit.unchained.error.ErrorType;
import com.bit.unchained.error.StakingException;
import com.bit.unchained.gate.JournaledMap;
import com.bit.unchained.gate.NonReentrantGate;
import com.bit.unchained.identity.IdentityRegistry;
import com.bit.unchained.nonce.ReplayGuard;
import com.bit.unchained.params.ParameterStore;
import com.bit.unchained.signature.EngineDomain;
import com.bit.unchained.signature.SignatureVerifier;
import com.bit.unchained.staking.StakingService;
import com.bit.unchained.structure.params.GlobalParams;
import com.bit.unchained.structure.payload.ParamsPayload;
import com.bit.unchained.structure.payload.PriceUpdatePayload;
import com.bit.unchained.structure.payload.SignerPayload;
import com.bit.unchained.structure.payload.TransferPayload;
import com.bit.unchained.structure.payload.VotePayload;
import com.bit.unchained.structure.sig.Signature;
import com.bit.unchained.structure.topic.TopicRecord;
import com.bit.unchained.voting.VotingService;
import com.bit.unchained.voting.effect.ParamsEffect;
import com.bit.unchained.voting.effect.PriceUpdateEffect;
import com.bit.unchained.voting.effect.TopicEffect;
import com.bit.unchained.voting.effect.TransferEffect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 职责：
 * 逐行验证签名、累计质押加权票数；
 * 维护议题状态（首次投票时间、已投票身份、累计票数、是否通过）；
 * 议题首次达到阈值时执行效果（转移、参数变更、价格更新）。
 */
@Slf4j
@Service
public class VotingServiceImpl implements VotingService {

    private static final BigInteger PERCENT = BigInteger.valueOf(100);

    private final NonReentrantGate gate;
    private final StakingService ledger;
    private final SignatureVerifier signatureVerifier;
    private final IdentityRegistry identityRegistry;
    private final ParameterStore parameterStore;
    private final StakingProperties properties;
    private final Clock clock;

    // 议题表：键 -> 议题记录，只增不删
    private final JournaledMap<TopicKey, TopicRecord> topics;

    private final TransferEffect transferEffect;
    private final ParamsEffect paramsEffect;
    private final PriceUpdateEffect priceUpdateEffect;

    public VotingServiceImpl(NonReentrantGate gate,
                             StakingService ledger,
                             SignatureVerifier signatureVerifier,
                             ReplayGuard replayGuard,
                             IdentityRegistry identityRegistry,
                             ParameterStore parameterStore,
                             EngineDomain domain,
                             StakingProperties properties,
                             Clock clock) {
        this.gate = gate;
        this.ledger = ledger;
        this.signatureVerifier = signatureVerifier;
        this.identityRegistry = identityRegistry;
        this.parameterStore = parameterStore;
        this.properties = properties;
        this.clock = clock;
        this.topics = new JournaledMap<>(gate);
        this.transferEffect = new TransferEffect(ledger, replayGuard, domain.getSelfAddress());
        this.paramsEffect = new ParamsEffect(parameterStore);
        this.priceUpdateEffect = new PriceUpdateEffect(ledger);
    }

    // ==================== 批量投票 ====================

    @Override
    public List<TopicRecord> transfer(List<TransferPayload> payloads, List<Signature> signatures) {
        return castVotes("transfer", payloads, signatures, transferEffect);
    }

    @Override
    public List<TopicRecord> setParams(List<ParamsPayload> payloads, List<Signature> signatures) {
        return castVotes("setParams", payloads, signatures, paramsEffect);
    }

    @Override
    public List<TopicRecord> setNftPrices(List<PriceUpdatePayload> payloads, List<Signature> signatures) {
        return castVotes("setNftPrices", payloads, signatures, priceUpdateEffect);
    }

    private <P extends VotePayload> List<TopicRecord> castVotes(String operation,
                                                                List<P> payloads,
                                                                List<Signature> signatures,
                                                                TopicEffect<P> effect) {
        return gate.execute(operation, () -> {
            if (payloads == null || signatures == null || payloads.size() != signatures.size()) {
                throw new StakingException(ErrorType.LENGTH_MISMATCH, "载荷与签名数量不一致");
            }
            long now = now();
            if (now < properties.getActivationTime()) {
                throw StakingException.forbidden("引擎尚未激活，激活时间: " + properties.getActivationTime());
            }
            // 整批使用同一份参数快照
            GlobalParams params = parameterStore.current();
            List<TopicRecord> results = new ArrayList<>(payloads.size());
            for (int row = 0; row < payloads.size(); row++) {
                results.add(vote(row, payloads.get(row), signatures.get(row), params, now, effect));
            }
            log.debug("{} 批次处理完成，行数: {}", operation, payloads.size());
            return results;
        });
    }

    private <P extends VotePayload> TopicRecord vote(int row,
                                                     P payload,
                                                     Signature signature,
                                                     GlobalParams params,
                                                     long now,
                                                     TopicEffect<P> effect) {
        if (payload == null) {
            throw StakingException.forbidden("行=" + row + " 载荷为空");
        }
        payload.validate();
        effect.precheck(row, payload);

        TopicKey key = payload.topicKey();
        TopicRecord topic = topics.get(key);
        if (topic == null) {
            topic = TopicRecord.open(key, payload, now);
            topics.put(key, topic);
        }
        long deadline = topic.deadline(params.getExpiration());
        if (now > deadline) {
            throw StakingException.atRow(ErrorType.TOPIC_EXPIRED, row);
        }

        Address voter = signatureVerifier.resolveVoter(payload, signature)
                .orElseThrow(() -> StakingException.atRow(ErrorType.INVALID_SIGNATURE, row));
        if (topic.hasVoted(voter)) {
            log.debug("行{} 投票者 {} 已对议题 {} 投过票，忽略", row, voter, key);
            return topic;
        }

        BigInteger power = ledger.getVotingPower(voter);
        if (power.signum() == 0) {
            throw StakingException.atRow(ErrorType.VOTING_POWER_ZERO, row);
        }
        if (ledger.getStake(voter).getUnlockTime() <= deadline) {
            throw StakingException.atRow(ErrorType.STAKE_EXPIRES_BEFORE_VOTE, row);
        }

        topic = topic.withVote(voter, power);
        log.debug("行{} {}议题 {} 投票者 {} 投票权 {} 累计 {}",
                row, topic.getKind().getDesc(), key, voter, power, topic.getVotedPower());
        if (!topic.isAccepted()) {
            BigInteger required = threshold(params);
            if (topic.getVotedPower().compareTo(required) >= 0) {
                topic = topic.accept();
                topics.put(key, topic);
                log.info("{}议题 {} 通过：票数 {} >= 阈值 {}",
                        topic.getKind().getDesc(), key, topic.getVotedPower(), required);
                effect.apply(row, payload);
                return topic;
            }
        }
        topics.put(key, topic);
        return topic;
    }

    // ==================== 身份绑定 ====================

    @Override
    public void setSigner(SignerPayload payload, Signature stakerSignature, Signature signerSignature) {
        gate.run("setSigner", () -> {
            if (payload == null || payload.getStaker() == null || payload.getSigner() == null) {
                throw StakingException.forbidden("代理签名载荷不完整");
            }
            byte[] structHash = payload.structHash();
            if (!signatureVerifier.isSignedBy(structHash, stakerSignature, payload.getStaker())) {
                throw StakingException.atRow(ErrorType.INVALID_SIGNATURE, 0);
            }
            if (!signatureVerifier.isSignedBy(structHash, signerSignature, payload.getSigner())) {
                throw StakingException.atRow(ErrorType.INVALID_SIGNATURE, 1);
            }
            identityRegistry.setDelegate(payload.getStaker(), payload.getSigner());
        });
    }

    @Override
    public void setAlternateAddress(Address staker, Address alternate) {
        gate.run("setAlternateAddress", () -> {
            if (staker == null || alternate == null) {
                throw StakingException.forbidden("地址不能为空");
            }
            identityRegistry.bindAlternate(staker, alternate);
        });
    }

    // ==================== 查询 ====================

    @Override
    public TopicRecord getTopic(VotePayload payload) {
        return topics.get(payload.topicKey());
    }

    @Override
    public TopicRecord getTopic(TopicKey key) {
        return topics.get(key);
    }

    @Override
    public boolean hasVoted(VotePayload payload, Address identity) {
        TopicRecord topic = getTopic(payload);
        return topic != null && topic.hasVoted(identity);
    }

    @Override
    public GlobalParams getParams() {
        return parameterStore.current();
    }

    @Override
    public BigInteger getConsensusThreshold() {
        return threshold(parameterStore.current());
    }

    @Override
    public Address delegateOf(Address staker) {
        return identityRegistry.delegateOf(staker);
    }

    @Override
    public Address stakerOfDelegate(Address signer) {
        return identityRegistry.stakerOfDelegate(signer);
    }

    private BigInteger threshold(GlobalParams params) {
        return ledger.getTotalVotingPower().multiply(BigInteger.valueOf(params.getThreshold())).divide(PERCENT);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
