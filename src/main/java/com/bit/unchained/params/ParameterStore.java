package com.bit.unchained.params;

import com.bit.unchained.custody.CustodianDirectory;
import com.bit.unchained.error.StakingException;
import com.bit.unchained.gate.JournaledValue;
import com.bit.unchained.gate.NonReentrantGate;
import com.bit.unchained.structure.params.GlobalParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 全局参数存储：一个不可变的带版本值，整体原子替换
 * 读取无锁；一次逻辑操作只取一次快照
 */
@Slf4j
@Component
public class ParameterStore {

    /**
     * 议题有效期上限（秒）：质押必须比议题活得更久，过大的有效期会让所有投票失效
     */
    public static final long MAX_EXPIRATION = 10L * 365 * 24 * 60 * 60;

    private final CustodianDirectory directory;
    private final JournaledValue<GlobalParams> params;

    public ParameterStore(NonReentrantGate gate, CustodianDirectory directory, GlobalParams initialParams) {
        this.directory = directory;
        validate(initialParams);
        this.params = new JournaledValue<>(gate, initialParams);
    }

    public GlobalParams current() {
        return params.get();
    }

    /**
     * 替换全局参数（需在门控内调用），版本号加一
     */
    public GlobalParams replace(GlobalParams next) {
        validate(next);
        GlobalParams previous = params.get();
        GlobalParams versioned = next.toBuilder().version(previous.getVersion() + 1).build();
        params.set(versioned);
        log.info("全局参数更新 v{} -> v{}: {}", previous.getVersion(), versioned.getVersion(), versioned);
        return versioned;
    }

    private void validate(GlobalParams candidate) {
        if (candidate.getThreshold() < 1 || candidate.getThreshold() > 100) {
            throw StakingException.forbidden("阈值必须在1..100之间: " + candidate.getThreshold());
        }
        if (candidate.getExpiration() <= 0 || candidate.getExpiration() > MAX_EXPIRATION) {
            throw StakingException.forbidden("议题有效期必须在1.." + MAX_EXPIRATION + "秒之间: " + candidate.getExpiration());
        }
        if (!directory.isFungible(candidate.getToken())) {
            throw StakingException.forbidden("未知的代币账本: " + candidate.getToken());
        }
        if (!directory.isNft(candidate.getNft())) {
            throw StakingException.forbidden("未知的NFT登记表: " + candidate.getNft());
        }
        if (!directory.isOracle(candidate.getNftTracker())) {
            throw StakingException.forbidden("未知的价格预言机: " + candidate.getNftTracker());
        }
        if (candidate.getCollector() == null) {
            throw StakingException.forbidden("惩罚收款方不能为空");
        }
    }
}
