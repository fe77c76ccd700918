package com.bit.unchained.sentinel;

import com.alibaba.csp.sentinel.init.InitFunc;
import com.alibaba.csp.sentinel.slots.block.RuleConstant;
import com.alibaba.csp.sentinel.slots.block.degrade.DegradeRule;
import com.alibaba.csp.sentinel.slots.block.degrade.DegradeRuleManager;
import com.alibaba.csp.sentinel.slots.block.flow.FlowRule;
import com.alibaba.csp.sentinel.slots.block.flow.FlowRuleManager;
import com.bit.unchained.api.StakingApi;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Sentinel 启动时通过 SPI（META-INF/services/com.alibaba.csp.sentinel.init.InitFunc）调用 init()
 * 中继接口的限流与熔断规则在这里加载
 */
@Slf4j
public class SentinelInit implements InitFunc {

    // 批量投票接口每秒最多请求数（引擎串行执行，过多请求只会排队）
    static final int VOTE_QPS = 200;
    static final int SIGNER_QPS = 50;

    @Override
    public void init() throws Exception {
        // 初始化限流规则
        initFlowRules();
        log.info("initFlowRules");
        // 初始化熔断规则
        initCircuitBreakerRules();
        log.info("initCircuitBreakerRules");
    }

    // 限流规则：限制接口的 QPS
    private void initFlowRules() {
        List<FlowRule> rules = new ArrayList<>();
        rules.add(qpsRule(StakingApi.RESOURCE_TRANSFER, VOTE_QPS));
        rules.add(qpsRule(StakingApi.RESOURCE_PARAMS, VOTE_QPS));
        rules.add(qpsRule(StakingApi.RESOURCE_PRICES, VOTE_QPS));
        rules.add(qpsRule(StakingApi.RESOURCE_SIGNER, SIGNER_QPS));
        FlowRuleManager.loadRules(rules);
    }

    /**
     * 托管方调用失败（非业务拒绝）过多时熔断转移接口：
     * 统计窗口10秒内至少5次请求、异常数达到5次，熔断30秒
     */
    private void initCircuitBreakerRules() {
        List<DegradeRule> rules = new ArrayList<>();
        DegradeRule transferRule = new DegradeRule(StakingApi.RESOURCE_TRANSFER);
        transferRule.setGrade(RuleConstant.DEGRADE_GRADE_EXCEPTION_COUNT);
        transferRule.setCount(5);
        transferRule.setTimeWindow(30);
        transferRule.setStatIntervalMs(10000);
        transferRule.setMinRequestAmount(5);
        rules.add(transferRule);
        DegradeRuleManager.loadRules(rules); // 加载熔断规则
    }

    private FlowRule qpsRule(String resource, int qps) {
        FlowRule rule = new FlowRule();
        // 资源名与 @SentinelResource 的 value 一致
        rule.setResource(resource);
        rule.setGrade(RuleConstant.FLOW_GRADE_QPS);
        rule.setCount(qps);
        return rule;
    }
}
