package com.bit.unchained.staking.impl;

import com.bit.unchained.common.Address;
import com.bit.unchained.custody.CustodianDirectory;
import com.bit.unchained.custody.FungibleCustodian;
import com.bit.unchained.custody.NftCustodian;
import com.bit.unchained.custody.NftReceiver;
import com.bit.unchained.custody.PriceOracle;
import com.bit.unchained.error.ErrorType;
import com.bit.unchained.error.StakingException;
import com.bit.unchained.gate.JournaledMap;
import com.bit.unchained.gate.JournaledValue;
import com.bit.unchained.gate.NonReentrantGate;
import com.bit.unchained.gate.UnitOfWork;
import com.bit.unchained.identity.IdentityRegistry;
import com.bit.unchained.params.ParameterStore;
import com.bit.unchained.signature.EngineDomain;
import com.bit.unchained.staking.StakingService;
import com.bit.unchained.staking.event.SlashedEvent;
import com.bit.unchained.staking.event.StakedEvent;
import com.bit.unchained.staking.event.UnStakedEvent;
import com.bit.unchained.structure.params.GlobalParams;
import com.bit.unchained.structure.stake.Stake;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class StakingServiceImpl implements StakingService, NftReceiver {

    private static final Object POOL_FLOW_KEY = PoolFlow.class;

    private final NonReentrantGate gate;
    private final ParameterStore parameterStore;
    private final CustodianDirectory directory;
    private final IdentityRegistry identityRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Address self;

    // ==================== 账本状态（写入登记撤销日志） ====================
    private final JournaledMap<Address, Stake> stakes;
    // NFT价格簿，投票权计算的唯一价格来源
    private final JournaledMap<Long, BigInteger> prices;
    // 已抵押NFT -> 质押者
    private final JournaledMap<Long, Address> nftStakers;
    private final JournaledValue<BigInteger> totalVotingPower;
    private final JournaledValue<BigInteger> totalStakedAmount;

    // 引擎自己发起转入时才接受NFT回调
    private final Set<Long> expectingNfts = ConcurrentHashMap.newKeySet();

    /**
     * 单个工作单元内尚未结算的资金池流入/流出
     */
    private static final class PoolFlow {
        private BigInteger inflow = BigInteger.ZERO;
        private BigInteger outflow = BigInteger.ZERO;
    }

    public StakingServiceImpl(NonReentrantGate gate,
                              ParameterStore parameterStore,
                              CustodianDirectory directory,
                              IdentityRegistry identityRegistry,
                              EngineDomain domain,
                              ApplicationEventPublisher eventPublisher,
                              Clock clock) {
        this.gate = gate;
        this.parameterStore = parameterStore;
        this.directory = directory;
        this.identityRegistry = identityRegistry;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.self = domain.getSelfAddress();
        this.stakes = new JournaledMap<>(gate);
        this.prices = new JournaledMap<>(gate);
        this.nftStakers = new JournaledMap<>(gate);
        this.totalVotingPower = new JournaledValue<>(gate, BigInteger.ZERO);
        this.totalStakedAmount = new JournaledValue<>(gate, BigInteger.ZERO);
    }

    /**
     * 在所有已知NFT登记表上登记接收回调
     */
    @PostConstruct
    public void init() {
        directory.nftCustodians().forEach(custodian -> custodian.registerReceiver(this));
        log.info("质押账本初始化完成，引擎地址: {}", self);
    }

    // ==================== 质押生命周期 ====================

    @Override
    public Stake stake(Address caller, long duration, BigInteger amount, List<Long> nftIds) {
        return gate.execute("stake", () -> {
            List<Long> ids = checkAssets(amount, nftIds);
            if (amount.signum() == 0 && ids.isEmpty()) {
                throw StakingException.of(ErrorType.AMOUNT_ZERO);
            }
            checkDuration(duration);
            Stake existing = stakes.get(caller);
            if (existing != null && existing.isActive()) {
                throw StakingException.of(ErrorType.ALREADY_STAKED);
            }
            pull(caller, amount, ids);
            Stake created = new Stake(amount, addSeconds(now(), duration), ImmutableSet.copyOf(ids));
            stakes.put(caller, created);
            BigInteger power = collateralize(caller, amount, ids);
            publishOnCommit(new StakedEvent(caller, created.getUnlockTime(), amount, ImmutableList.copyOf(ids)));
            log.info("质押成功 staker={} amount={} nfts={} unlockTime={} power={}",
                    caller, amount, ids, created.getUnlockTime(), power);
            return created;
        });
    }

    @Override
    public Stake increaseStake(Address caller, BigInteger amount, List<Long> nftIds) {
        return gate.execute("increaseStake", () -> {
            List<Long> ids = checkAssets(amount, nftIds);
            Stake existing = requireActive(caller);
            if (amount.signum() == 0 && ids.isEmpty()) {
                throw StakingException.of(ErrorType.AMOUNT_ZERO);
            }
            pull(caller, amount, ids);
            Stake increased = existing.withAmount(existing.getAmount().add(amount)).addNfts(ids);
            stakes.put(caller, increased);
            BigInteger power = collateralize(caller, amount, ids);
            publishOnCommit(new StakedEvent(caller, increased.getUnlockTime(), amount, ImmutableList.copyOf(ids)));
            log.info("追加质押 staker={} amount={} nfts={} power+={}", caller, amount, ids, power);
            return increased;
        });
    }

    @Override
    public Stake extend(Address caller, long duration) {
        return gate.execute("extend", () -> {
            checkDuration(duration);
            Stake existing = requireActive(caller);
            Stake extended = existing.withUnlockTime(addSeconds(existing.getUnlockTime(), duration));
            stakes.put(caller, extended);
            log.info("延长锁定 staker={} unlockTime {} -> {}", caller, existing.getUnlockTime(), extended.getUnlockTime());
            return extended;
        });
    }

    @Override
    public void unstake(Address caller) {
        gate.run("unstake", () -> {
            Stake existing = requireActive(caller);
            if (now() < existing.getUnlockTime()) {
                throw new StakingException(ErrorType.NOT_UNLOCKED, "解锁时间: " + existing.getUnlockTime());
            }
            List<Long> ids = existing.getNftIds().asList();
            stakes.put(caller, Stake.EMPTY);
            decollateralize(existing.getAmount(), ids);
            release(caller, existing.getAmount(), ids);
            publishOnCommit(new UnStakedEvent(caller, existing.getAmount(), ids));
            log.info("解除质押 staker={} amount={} nfts={}", caller, existing.getAmount(), ids);
        });
    }

    @Override
    public void recoverToken(Address token, Address to, BigInteger amount) {
        gate.run("recoverToken", () -> {
            if (token == null || to == null || amount == null || amount.signum() <= 0) {
                throw StakingException.forbidden("找回参数不合法 token=" + token + " to=" + to + " amount=" + amount);
            }
            if (token.equals(parameterStore.current().getToken())) {
                throw StakingException.forbidden("不能找回质押代币: " + token);
            }
            FungibleCustodian custodian = directory.fungible(token);
            gate.current().defer(UnitOfWork.Phase.PAYOUT, "找回代币 " + token + " " + amount + " -> " + to,
                    () -> custodian.transfer(self, to, amount),
                    () -> custodian.transferFrom(to, self, amount));
            log.warn("找回误转入的代币 token={} to={} amount={}", token, to, amount);
        });
    }

    // ==================== 查询 ====================

    @Override
    public Stake getStake(Address staker) {
        Stake stake = stakes.get(staker);
        return stake == null ? Stake.EMPTY : stake;
    }

    @Override
    public Stake getStakeByAlternate(Address alternate) {
        Address staker = identityRegistry.stakerOfAlternate(alternate);
        return staker == null ? Stake.EMPTY : getStake(staker);
    }

    @Override
    public BigInteger getVotingPower(Address staker) {
        Stake stake = stakes.get(staker);
        if (stake == null || !stake.isActive()) {
            return BigInteger.ZERO;
        }
        return stake.getAmount().add(valuation(stake.getNftIds()));
    }

    @Override
    public BigInteger getTotalVotingPower() {
        return totalVotingPower.get();
    }

    @Override
    public BigInteger getTotalStakedAmount() {
        return totalStakedAmount.get();
    }

    @Override
    public BigInteger getNftPrice(long id) {
        return prices.getOrDefault(id, BigInteger.ZERO);
    }

    @Override
    public BigInteger getFreePoolBalance() {
        FungibleCustodian token = directory.fungible(parameterStore.current().getToken());
        BigInteger balance = token.balanceOf(self);
        if (gate.isEntered()) {
            PoolFlow flow = poolFlow();
            balance = balance.add(flow.inflow).subtract(flow.outflow);
        }
        return balance.subtract(totalStakedAmount.get());
    }

    // ==================== 议题效果 ====================

    @Override
    public void debit(Address from, Address to, BigInteger amount, List<Long> nftIds) {
        Stake existing = stakes.get(from);
        if (existing == null || !existing.isActive()) {
            throw StakingException.forbidden(from + " 没有有效质押");
        }
        if (existing.getAmount().compareTo(amount) < 0) {
            throw StakingException.forbidden(from + " 质押金额不足: " + existing.getAmount() + " < " + amount);
        }
        for (Long id : nftIds) {
            if (!existing.getNftIds().contains(id)) {
                throw StakingException.forbidden(from + " 未抵押NFT: " + id);
            }
        }
        stakes.put(from, existing.withAmount(existing.getAmount().subtract(amount)).removeNfts(nftIds));
        decollateralize(amount, nftIds);
        publishOnCommit(new SlashedEvent(from, to, amount, ImmutableList.copyOf(nftIds)));
        log.info("扣减质押 staker={} -> {} amount={} nfts={}", from, to, amount, nftIds);
    }

    @Override
    public void release(Address to, BigInteger amount, List<Long> nftIds) {
        if (to.equals(self)) {
            if (!nftIds.isEmpty()) {
                throw StakingException.forbidden("NFT不能转入资金池");
            }
            return;
        }
        UnitOfWork unit = gate.current();
        GlobalParams params = parameterStore.current();
        if (amount.signum() > 0) {
            FungibleCustodian token = directory.fungible(params.getToken());
            PoolFlow flow = poolFlow();
            flow.outflow = flow.outflow.add(amount);
            unit.defer(UnitOfWork.Phase.PAYOUT, "转出代币 " + amount + " -> " + to,
                    () -> token.transfer(self, to, amount),
                    () -> token.transferFrom(to, self, amount));
        }
        if (!nftIds.isEmpty()) {
            NftCustodian nft = directory.nft(params.getNft());
            for (Long id : nftIds) {
                unit.defer(UnitOfWork.Phase.PAYOUT, "转出NFT " + id + " -> " + to,
                        () -> nft.transferNft(self, to, id),
                        () -> receiveNft(nft, to, id));
            }
        }
    }

    @Override
    public void applyPrices(List<Long> nftIds, List<BigInteger> newPrices) {
        UnitOfWork unit = gate.current();
        PriceOracle oracle = oracle();
        BigInteger delta = BigInteger.ZERO;
        for (int i = 0; i < nftIds.size(); i++) {
            long id = nftIds.get(i);
            BigInteger price = newPrices.get(i);
            BigInteger previous = prices.put(id, price);
            if (nftStakers.containsKey(id)) {
                delta = delta.add(price.subtract(previous == null ? BigInteger.ZERO : previous));
            }
            BigInteger[] oraclePrevious = new BigInteger[1];
            unit.defer(UnitOfWork.Phase.SYNC, "同步NFT价格 " + id + "=" + price,
                    () -> {
                        oraclePrevious[0] = oracle.getPrice(id);
                        oracle.setPrice(id, price);
                    },
                    () -> oracle.setPrice(id, oraclePrevious[0]));
        }
        if (delta.signum() != 0) {
            totalVotingPower.set(totalVotingPower.get().add(delta));
        }
        log.info("价格更新 nfts={} prices={} 资金池变化={}", nftIds, newPrices, delta);
    }

    // ==================== NFT接收回调 ====================

    @Override
    public Address receiverAddress() {
        return self;
    }

    @Override
    public void onNftReceived(Address registry, Address from, long id) {
        if (!registry.equals(parameterStore.current().getNft()) || !expectingNfts.contains(id)) {
            log.warn("拒绝非预期的NFT registry={} from={} id={}", registry, from, id);
            throw new StakingException(ErrorType.WRONG_ASSET, "registry=" + registry + " id=" + id);
        }
        log.debug("收到质押NFT {} from {}", id, from);
    }

    // ==================== 内部方法 ====================

    /**
     * 登记转入结算：代币与NFT从持有人转入引擎，失败时已完成的转入逆序退回
     */
    private void pull(Address holder, BigInteger amount, List<Long> ids) {
        UnitOfWork unit = gate.current();
        GlobalParams params = parameterStore.current();
        if (amount.signum() > 0) {
            FungibleCustodian token = directory.fungible(params.getToken());
            PoolFlow flow = poolFlow();
            flow.inflow = flow.inflow.add(amount);
            unit.defer(UnitOfWork.Phase.PULL, "转入代币 " + holder + " 数量=" + amount,
                    () -> token.transferFrom(holder, self, amount),
                    () -> token.transfer(self, holder, amount));
        }
        if (!ids.isEmpty()) {
            NftCustodian nft = directory.nft(params.getNft());
            for (Long id : ids) {
                unit.defer(UnitOfWork.Phase.PULL, "转入NFT " + holder + " id=" + id,
                        () -> receiveNft(nft, holder, id),
                        () -> nft.transferNft(self, holder, id));
            }
        }
    }

    private void receiveNft(NftCustodian nft, Address holder, long id) {
        expectingNfts.add(id);
        try {
            nft.transferNft(holder, self, id);
        } finally {
            expectingNfts.remove(id);
        }
    }

    /**
     * 计入资金池，首次抵押的NFT从预言机读取初始价格
     * @return 新增投票权
     */
    private BigInteger collateralize(Address staker, BigInteger amount, List<Long> ids) {
        for (Long id : ids) {
            if (!prices.containsKey(id)) {
                prices.put(id, oracle().getPrice(id));
            }
            nftStakers.put(id, staker);
        }
        BigInteger power = amount.add(valuation(ids));
        totalStakedAmount.set(totalStakedAmount.get().add(amount));
        totalVotingPower.set(totalVotingPower.get().add(power));
        return power;
    }

    private void decollateralize(BigInteger amount, List<Long> ids) {
        BigInteger power = amount.add(valuation(ids));
        for (Long id : ids) {
            nftStakers.remove(id);
        }
        totalStakedAmount.set(totalStakedAmount.get().subtract(amount));
        totalVotingPower.set(totalVotingPower.get().subtract(power));
    }

    private BigInteger valuation(Iterable<Long> ids) {
        BigInteger sum = BigInteger.ZERO;
        for (Long id : ids) {
            sum = sum.add(getNftPrice(id));
        }
        return sum;
    }

    private List<Long> checkAssets(BigInteger amount, List<Long> nftIds) {
        if (amount == null || amount.signum() < 0) {
            throw StakingException.forbidden("非法的质押金额: " + amount);
        }
        List<Long> ids = nftIds == null ? Collections.emptyList() : nftIds;
        for (Long id : ids) {
            if (id == null || id < 0) {
                throw StakingException.forbidden("非法的NFT编号: " + id);
            }
            if (nftStakers.containsKey(id)) {
                throw StakingException.forbidden("NFT已被抵押: " + id);
            }
        }
        if (ImmutableSet.copyOf(ids).size() != ids.size()) {
            throw StakingException.forbidden("NFT编号重复: " + ids);
        }
        return ids;
    }

    private void checkDuration(long duration) {
        if (duration == 0) {
            throw StakingException.of(ErrorType.DURATION_ZERO);
        }
        if (duration < 0) {
            throw StakingException.forbidden("非法的锁定时长: " + duration);
        }
    }

    private Stake requireActive(Address caller) {
        Stake existing = stakes.get(caller);
        if (existing == null || !existing.isActive()) {
            throw StakingException.of(ErrorType.STAKE_ZERO);
        }
        return existing;
    }

    private PriceOracle oracle() {
        return directory.oracle(parameterStore.current().getNftTracker());
    }

    /**
     * 通知在工作单元提交后发出，回滚则不发
     */
    private void publishOnCommit(Object event) {
        gate.current().onCommit(() -> eventPublisher.publishEvent(event));
    }

    private PoolFlow poolFlow() {
        return gate.current().attachment(POOL_FLOW_KEY, PoolFlow::new);
    }

    private long addSeconds(long base, long seconds) {
        try {
            return Math.addExact(base, seconds);
        } catch (ArithmeticException e) {
            throw new StakingException(ErrorType.FORBIDDEN, "时间溢出: " + base + " + " + seconds, e);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
