package com.bit.unchained.api;

import com.alibaba.csp.sentinel.annotation.SentinelResource;
import com.alibaba.csp.sentinel.slots.block.BlockException;
import com.bit.unchained.api.dto.PoolView;
import com.bit.unchained.api.dto.SignerHandshake;
import com.bit.unchained.api.dto.VoteBatch;
import com.bit.unchained.common.Address;
import com.bit.unchained.common.TopicKey;
import com.bit.unchained.error.StakingException;
import com.bit.unchained.result.Result;
import com.bit.unchained.staking.StakingService;
import com.bit.unchained.structure.params.GlobalParams;
import com.bit.unchained.structure.payload.ParamsPayload;
import com.bit.unchained.structure.payload.PriceUpdatePayload;
import com.bit.unchained.structure.payload.TransferPayload;
import com.bit.unchained.structure.stake.Stake;
import com.bit.unchained.structure.topic.TopicRecord;
import com.bit.unchained.voting.VotingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * 中继接口：任何中继方都可以批量提交他人签好的投票
 * 质押生命周期需要调用方身份认证，不在此暴露
 */
@Slf4j
@RestController
@RequestMapping("/staking")
public class StakingApi {

    public static final String RESOURCE_TRANSFER = "stakingApi:transfer";
    public static final String RESOURCE_PARAMS = "stakingApi:setParams";
    public static final String RESOURCE_PRICES = "stakingApi:setNftPrices";
    public static final String RESOURCE_SIGNER = "stakingApi:setSigner";

    @Autowired
    private VotingService votingService;

    @Autowired
    private StakingService stakingService;

    // 提交资产转移投票
    @PostMapping("/transfer")
    @SentinelResource(value = RESOURCE_TRANSFER, blockHandler = "transferBlockHandler",
            exceptionsToIgnore = StakingException.class)
    public Result<List<TopicRecord>> transfer(@RequestBody VoteBatch<TransferPayload> batch) {
        return Result.OK(votingService.transfer(batch.getPayloads(), batch.getSignatures()));
    }

    // 提交参数变更投票
    @PostMapping("/params")
    @SentinelResource(value = RESOURCE_PARAMS, blockHandler = "paramsBlockHandler",
            exceptionsToIgnore = StakingException.class)
    public Result<List<TopicRecord>> setParams(@RequestBody VoteBatch<ParamsPayload> batch) {
        return Result.OK(votingService.setParams(batch.getPayloads(), batch.getSignatures()));
    }

    // 提交NFT价格更新投票
    @PostMapping("/prices")
    @SentinelResource(value = RESOURCE_PRICES, blockHandler = "pricesBlockHandler",
            exceptionsToIgnore = StakingException.class)
    public Result<List<TopicRecord>> setNftPrices(@RequestBody VoteBatch<PriceUpdatePayload> batch) {
        return Result.OK(votingService.setNftPrices(batch.getPayloads(), batch.getSignatures()));
    }

    // 代理签名握手
    @PostMapping("/signer")
    @SentinelResource(value = RESOURCE_SIGNER, blockHandler = "signerBlockHandler",
            exceptionsToIgnore = StakingException.class)
    public Result<String> setSigner(@RequestBody SignerHandshake handshake) {
        votingService.setSigner(handshake.getPayload(), handshake.getStakerSignature(), handshake.getSignerSignature());
        return Result.OK("代理签名绑定成功", handshake.getPayload().getSigner().toHex());
    }

    // ==================== 查询 ====================

    @GetMapping("/stake")
    public Result<Stake> getStake(@RequestParam String address) {
        return Result.OK(stakingService.getStake(Address.fromHex(address)));
    }

    @GetMapping("/stakeByAlternate")
    public Result<Stake> getStakeByAlternate(@RequestParam String address) {
        return Result.OK(stakingService.getStakeByAlternate(Address.fromHex(address)));
    }

    @GetMapping("/power")
    public Result<BigInteger> getVotingPower(@RequestParam String address) {
        return Result.OK(stakingService.getVotingPower(Address.fromHex(address)));
    }

    @GetMapping("/pool")
    public Result<PoolView> getPool() {
        return Result.OK(new PoolView(
                stakingService.getTotalVotingPower(),
                stakingService.getTotalStakedAmount(),
                stakingService.getFreePoolBalance(),
                votingService.getConsensusThreshold()));
    }

    @GetMapping("/price")
    public Result<BigInteger> getNftPrice(@RequestParam long id) {
        return Result.OK(stakingService.getNftPrice(id));
    }

    @GetMapping("/params")
    public Result<GlobalParams> getParams() {
        return Result.OK(votingService.getParams());
    }

    // 议题不存在时 data 为空
    @GetMapping("/topic")
    public Result<TopicRecord> getTopic(@RequestParam String key) {
        return Result.OK(votingService.getTopic(TopicKey.fromHex(key)));
    }

    @GetMapping("/delegate")
    public Result<Address> getDelegate(@RequestParam String staker) {
        return Result.OK(votingService.delegateOf(Address.fromHex(staker)));
    }

    // ==================== 限流处理 ====================

    public Result<List<TopicRecord>> transferBlockHandler(VoteBatch<TransferPayload> batch, BlockException e) {
        log.info("阻塞线路 {}", RESOURCE_TRANSFER);
        return Result.busy("系统繁忙，请稍后重试（已触发限流/熔断）");
    }

    public Result<List<TopicRecord>> paramsBlockHandler(VoteBatch<ParamsPayload> batch, BlockException e) {
        log.info("阻塞线路 {}", RESOURCE_PARAMS);
        return Result.busy("系统繁忙，请稍后重试（已触发限流/熔断）");
    }

    public Result<List<TopicRecord>> pricesBlockHandler(VoteBatch<PriceUpdatePayload> batch, BlockException e) {
        log.info("阻塞线路 {}", RESOURCE_PRICES);
        return Result.busy("系统繁忙，请稍后重试（已触发限流/熔断）");
    }

    public Result<String> signerBlockHandler(SignerHandshake handshake, BlockException e) {
        log.info("阻塞线路 {}", RESOURCE_SIGNER);
        return Result.busy("系统繁忙，请稍后重试（已触发限流/熔断）");
    }
}
