package com.bit.unchained.voting.effect;

import com.bit.unchained.error.ErrorType;
import com.bit.unchained.error.StakingException;
import com.bit.unchained.staking.StakingService;
import com.bit.unchained.structure.payload.PriceUpdatePayload;

public class PriceUpdateEffect implements TopicEffect<PriceUpdatePayload> {

    private final StakingService ledger;

    public PriceUpdateEffect(StakingService ledger) {
        this.ledger = ledger;
    }

    @Override
    public void precheck(int row, PriceUpdatePayload payload) {
        if (payload.getNftIds().size() != payload.getPrices().size()) {
            throw new StakingException(ErrorType.LENGTH_MISMATCH,
                    "行=" + row + " nftIds=" + payload.getNftIds().size() + " prices=" + payload.getPrices().size());
        }
    }

    @Override
    public void apply(int row, PriceUpdatePayload payload) {
        ledger.applyPrices(payload.getNftIds(), payload.getPrices());
    }
}
