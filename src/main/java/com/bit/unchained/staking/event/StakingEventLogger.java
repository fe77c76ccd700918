package com.bit.unchained.staking.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 质押生命周期通知：事件在门控释放、状态提交之后发出
 */
@Slf4j
@Component
public class StakingEventLogger {

    @EventListener
    public void onStaked(StakedEvent event) {
        log.info("[Staked] staker={} amount={} nfts={} unlockTime={}",
                event.getStaker(), event.getAmount(), event.getNftIds(), event.getUnlockTime());
    }

    @EventListener
    public void onUnStaked(UnStakedEvent event) {
        log.info("[UnStaked] staker={} amount={} nfts={}", event.getStaker(), event.getAmount(), event.getNftIds());
    }

    @EventListener
    public void onSlashed(SlashedEvent event) {
        log.warn("[Slashed] staker={} to={} amount={} nfts={}",
                event.getStaker(), event.getTo(), event.getAmount(), event.getNftIds());
    }
}
