package com.bit.unchained.voting.effect;

import com.bit.unchained.common.Address;
import com.bit.unchained.error.StakingException;
import com.bit.unchained.nonce.ReplayGuard;
import com.bit.unchained.staking.StakingService;
import com.bit.unchained.structure.payload.TransferPayload;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * 资产转移：from 为引擎地址时只能动用资金池中的自由余额且不能带NFT，
 * 否则从 from 的质押中扣除；nonce 按接收方消费
 */
@Slf4j
public class TransferEffect implements TopicEffect<TransferPayload> {

    private final StakingService ledger;
    private final ReplayGuard replayGuard;
    private final Address self;

    public TransferEffect(StakingService ledger, ReplayGuard replayGuard, Address self) {
        this.ledger = ledger;
        this.replayGuard = replayGuard;
        this.self = self;
    }

    @Override
    public void precheck(int row, TransferPayload payload) {
        replayGuard.checkUnused(row, payload.getTo(), payload.getNonces());
    }

    @Override
    public void apply(int row, TransferPayload payload) {
        replayGuard.consume(row, payload.getTo(), payload.getNonces());
        BigInteger amount = payload.getAmount();
        if (payload.getFrom().equals(self)) {
            if (!payload.getNftIds().isEmpty()) {
                throw StakingException.forbidden("资金池转出不能包含NFT");
            }
            BigInteger free = ledger.getFreePoolBalance();
            if (amount.compareTo(free) > 0) {
                throw StakingException.forbidden("资金池自由余额不足: " + free + " < " + amount);
            }
        } else {
            ledger.debit(payload.getFrom(), payload.getTo(), amount, payload.getNftIds());
        }
        ledger.release(payload.getTo(), amount, payload.getNftIds());
        log.info("转移议题通过 {} -> {} amount={} nfts={} nonces={}",
                payload.getFrom(), payload.getTo(), amount, payload.getNftIds(), payload.getNonces());
    }
}
