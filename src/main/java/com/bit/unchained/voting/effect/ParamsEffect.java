package com.bit.unchained.voting.effect;

import com.bit.unchained.error.StakingException;
import com.bit.unchained.params.ParameterStore;
import com.bit.unchained.structure.params.GlobalParams;
import com.bit.unchained.structure.payload.ParamsPayload;

import java.math.BigInteger;

public class ParamsEffect implements TopicEffect<ParamsPayload> {

    private static final BigInteger MAX_THRESHOLD = BigInteger.valueOf(100);
    private static final BigInteger MAX_EXPIRATION = BigInteger.valueOf(ParameterStore.MAX_EXPIRATION);

    private final ParameterStore parameterStore;

    public ParamsEffect(ParameterStore parameterStore) {
        this.parameterStore = parameterStore;
    }

    @Override
    public void apply(int row, ParamsPayload payload) {
        if (payload.getThreshold().compareTo(MAX_THRESHOLD) > 0) {
            throw StakingException.forbidden("阈值必须在1..100之间: " + payload.getThreshold());
        }
        if (payload.getExpiration().compareTo(MAX_EXPIRATION) > 0) {
            throw StakingException.forbidden("议题有效期超过上限 " + ParameterStore.MAX_EXPIRATION + ": " + payload.getExpiration());
        }
        // 版本号由存储统一递增
        parameterStore.replace(GlobalParams.builder()
                .token(payload.getToken())
                .nft(payload.getNft())
                .nftTracker(payload.getNftTracker())
                .threshold(payload.getThreshold().intValue())
                .expiration(payload.getExpiration().longValue())
                .collector(payload.getCollector())
                .build());
    }
}
