package com.bit.unchained.support;

import com.bit.unchained.common.Address;
import com.bit.unchained.config.StakingProperties;
import com.bit.unchained.custody.CustodianDirectory;
import com.bit.unchained.custody.memory.MemoryNftRegistry;
import com.bit.unchained.custody.memory.MemoryPriceOracle;
import com.bit.unchained.custody.memory.MemoryTokenLedger;
import com.bit.unchained.gate.NonReentrantGate;
import com.bit.unchained.identity.impl.IdentityRegistryImpl;
import com.bit.unchained.nonce.impl.ReplayGuardImpl;
import com.bit.unchained.params.ParameterStore;
import com.bit.unchained.signature.EngineDomain;
import com.bit.unchained.signature.impl.SignatureVerifierImpl;
import com.bit.unchained.staking.impl.StakingServiceImpl;
import com.bit.unchained.structure.params.GlobalParams;
import com.bit.unchained.structure.stake.Stake;
import com.bit.unchained.voting.impl.VotingServiceImpl;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 手工装配的完整引擎：内存托管方 + 可调时钟
 * 初始参数：阈值51%，有效期1天；生命周期通知记录在 events 中
 */
public class EngineFixture {

    public static final long START = 1_700_000_000L;
    public static final long DAY = 86_400L;
    public static final long MONTH = 30 * DAY;

    public static final Address ENGINE = Address.fromHex("0x5fbdb2315678afecb367f032d93f642f64180aa3");
    public static final Address TOKEN = Address.fromHex("0xe7f1725e7734ce288f8367e1bb143e90bb3f0512");
    public static final Address NFT = Address.fromHex("0x9fe46736679d2d9a65f0992f2272de9f3c7fa6e0");
    public static final Address TRACKER = Address.fromHex("0xcf7ed3acca5a467e9e704c703e8d87f634fb0fc9");
    public static final Address COLLECTOR = Address.fromHex("0x00000000000000000000000000000000000c0113");

    public final MutableClock clock = new MutableClock(START);
    public final NonReentrantGate gate = new NonReentrantGate();
    public final MemoryTokenLedger token = new MemoryTokenLedger(TOKEN);
    public final MemoryNftRegistry nft;
    public final MemoryPriceOracle oracle = new MemoryPriceOracle(TRACKER);
    public final CustodianDirectory directory = new CustodianDirectory();
    public final EngineDomain domain = new EngineDomain("Unchained", "1", 31337L, ENGINE);
    public final StakingProperties properties = new StakingProperties();
    // 提交后发出的生命周期通知
    public final List<Object> events = new ArrayList<>();
    public final ParameterStore parameterStore;
    public final IdentityRegistryImpl identity;
    public final ReplayGuardImpl replayGuard;
    public final SignatureVerifierImpl verifier;
    public final StakingServiceImpl staking;
    public final VotingServiceImpl voting;

    public EngineFixture() {
        this(new MemoryNftRegistry(NFT));
    }

    public EngineFixture(MemoryNftRegistry nftRegistry) {
        this.nft = nftRegistry;
        directory.register(token).register(nft).register(oracle);
        GlobalParams initial = GlobalParams.builder()
                .token(TOKEN)
                .nft(NFT)
                .nftTracker(TRACKER)
                .threshold(51)
                .expiration(DAY)
                .collector(COLLECTOR)
                .version(0L)
                .build();
        parameterStore = new ParameterStore(gate, directory, initial);
        identity = new IdentityRegistryImpl(gate);
        replayGuard = new ReplayGuardImpl(gate);
        verifier = new SignatureVerifierImpl(domain, identity);
        staking = new StakingServiceImpl(gate, parameterStore, directory, identity, domain, events::add, clock);
        staking.init();
        voting = new VotingServiceImpl(gate, staking, verifier, replayGuard, identity, parameterStore,
                domain, properties, clock);
    }

    /**
     * 铸币后质押一个月
     */
    public Stake stake(TestSigner signer, long amount) {
        return stake(signer, amount, MONTH);
    }

    public Stake stake(TestSigner signer, long amount, long duration) {
        token.mint(signer.address(), BigInteger.valueOf(amount));
        return staking.stake(signer.address(), duration, BigInteger.valueOf(amount), List.of());
    }

    /**
     * 抵押NFT（先铸造并在预言机设置价格）
     */
    public Stake stakeWithNft(TestSigner signer, long amount, long nftId, long price) {
        token.mint(signer.address(), BigInteger.valueOf(amount));
        nft.mint(signer.address(), nftId);
        oracle.setPrice(nftId, BigInteger.valueOf(price));
        return staking.stake(signer.address(), MONTH, BigInteger.valueOf(amount), List.of(nftId));
    }

    /**
     * 逐个质押者重新计算的投票权之和
     */
    public BigInteger recomputedPool(TestSigner... stakers) {
        return Arrays.stream(stakers)
                .map(s -> staking.getVotingPower(s.address()))
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    public static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }
}
