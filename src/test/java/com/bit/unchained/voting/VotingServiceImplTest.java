package com.bit.unchained.voting;

import com.bit.unchained.common.Address;
import com.bit.unchained.error.ErrorType;
import com.bit.unchained.custody.memory.MemoryPriceOracle;
import com.bit.unchained.error.StakingException;
import com.bit.unchained.params.ParameterStore;
import com.bit.unchained.signature.EngineDomain;
import com.bit.unchained.staking.event.SlashedEvent;
import com.bit.unchained.structure.params.GlobalParams;
import com.bit.unchained.structure.payload.ParamsPayload;
import com.bit.unchained.structure.payload.PriceUpdatePayload;
import com.bit.unchained.structure.payload.SignerPayload;
import com.bit.unchained.structure.payload.TransferPayload;
import com.bit.unchained.structure.sig.Signature;
import com.bit.unchained.structure.topic.TopicRecord;
import com.bit.unchained.support.EngineFixture;
import com.bit.unchained.support.TestSigner;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.bit.unchained.support.EngineFixture.*;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class VotingServiceImplTest {

    private final TestSigner alice = TestSigner.of(101);
    private final TestSigner bob = TestSigner.of(102);
    private final TestSigner carol = TestSigner.of(103);
    private final TestSigner dave = TestSigner.of(104);
    private final TestSigner delegate = TestSigner.of(201);
    private final TestSigner otherDelegate = TestSigner.of(202);
    private final TestSigner outsider = TestSigner.of(301);

    private EngineFixture f;
    private VotingService voting;

    @BeforeEach
    void setUp() {
        f = new EngineFixture();
        voting = f.voting;
    }

    // ==================== 资产转移 ====================

    @Test
    void testThreeOfFourSlashToCollector() {
        for (TestSigner s : List.of(alice, bob, carol, dave)) {
            f.stake(s, 500);
        }
        assertEquals(big(2000), f.staking.getTotalVotingPower());
        assertEquals(big(1020), voting.getConsensusThreshold());

        List<TransferPayload> payloads = new ArrayList<>();
        List<Signature> signatures = new ArrayList<>();
        for (TestSigner s : List.of(alice, bob, carol)) {
            TransferPayload p = transfer(s, dave.address(), COLLECTOR, 100, List.of(), 1);
            payloads.add(p);
            signatures.add(s.sign(f.domain, p));
        }

        List<TopicRecord> results = voting.transfer(payloads, signatures);
        assertFalse(results.get(0).isAccepted());
        assertFalse(results.get(1).isAccepted());
        assertTrue(results.get(2).isAccepted());
        assertEquals(big(1500), results.get(2).getVotedPower());

        assertEquals(big(400), f.staking.getStake(dave.address()).getAmount());
        assertEquals(big(100), f.token.balanceOf(COLLECTOR));
        assertEquals(big(1900), f.token.balanceOf(ENGINE));
        assertEquals(big(1900), f.staking.getTotalVotingPower());
        assertEquals(big(1900), f.staking.getTotalStakedAmount());
        assertEquals(f.recomputedPool(alice, bob, carol, dave), f.staking.getTotalVotingPower());
        assertTrue(f.replayGuard.isUsed(COLLECTOR, big(1)));
        assertEquals(new SlashedEvent(dave.address(), COLLECTOR, big(100), List.of()), f.events.get(f.events.size() - 1));
    }

    @Test
    void testResubmittedTransferRejectedByNonce() {
        for (TestSigner s : List.of(alice, bob, carol, dave)) {
            f.stake(s, 500);
        }
        List<TransferPayload> payloads = new ArrayList<>();
        List<Signature> signatures = new ArrayList<>();
        for (TestSigner s : List.of(alice, bob, carol)) {
            TransferPayload p = transfer(s, dave.address(), COLLECTOR, 100, List.of(), 1);
            payloads.add(p);
            signatures.add(s.sign(f.domain, p));
        }
        voting.transfer(payloads, signatures);

        StakingException replay = assertThrows(StakingException.class, () -> voting.transfer(payloads, signatures));
        assertEquals(ErrorType.NONCE_USED, replay.getErrorType());
        assertEquals(Integer.valueOf(0), replay.getIndex());
        assertEquals(big(1), replay.getNonce());

        // 换一个投票者重新签名同样被拒绝
        TransferPayload resigned = transfer(dave, dave.address(), COLLECTOR, 100, List.of(), 1);
        assertError(ErrorType.NONCE_USED, 0,
                () -> voting.transfer(List.of(resigned), List.of(dave.sign(f.domain, resigned))));

        assertEquals(big(100), f.token.balanceOf(COLLECTOR));
        assertEquals(big(400), f.staking.getStake(dave.address()).getAmount());
    }

    @Test
    void testNoncesAreScopedToDestination() {
        f.stake(alice, 600);
        f.stake(bob, 400);
        TransferPayload toCollector = transfer(alice, bob.address(), COLLECTOR, 10, List.of(), 7);
        voting.transfer(List.of(toCollector), List.of(alice.sign(f.domain, toCollector)));

        // 相同nonce、不同接收方不冲突
        TransferPayload toOutsider = transfer(alice, bob.address(), outsider.address(), 10, List.of(), 7);
        voting.transfer(List.of(toOutsider), List.of(alice.sign(f.domain, toOutsider)));
        assertEquals(big(10), f.token.balanceOf(outsider.address()));
        assertEquals(big(380), f.staking.getStake(bob.address()).getAmount());
    }

    @Test
    void testPoolSourcedTransferUsesFreeBalanceOnly() {
        f.stake(alice, 600);
        f.stake(bob, 400);
        f.token.mint(ENGINE, big(300));
        assertEquals(big(300), f.staking.getFreePoolBalance());

        TransferPayload payout = transfer(alice, ENGINE, outsider.address(), 250, List.of(), 1);
        List<TopicRecord> results = voting.transfer(List.of(payout), List.of(alice.sign(f.domain, payout)));
        assertTrue(results.get(0).isAccepted());
        assertEquals(big(250), f.token.balanceOf(outsider.address()));
        assertEquals(big(50), f.staking.getFreePoolBalance());

        TransferPayload tooMuch = transfer(alice, ENGINE, outsider.address(), 51, List.of(), 2);
        assertError(ErrorType.FORBIDDEN, null,
                () -> voting.transfer(List.of(tooMuch), List.of(alice.sign(f.domain, tooMuch))));

        TransferPayload withNft = transfer(alice, ENGINE, outsider.address(), 1, List.of(5L), 3);
        assertError(ErrorType.FORBIDDEN, null,
                () -> voting.transfer(List.of(withNft), List.of(alice.sign(f.domain, withNft))));

        assertEquals(big(250), f.token.balanceOf(outsider.address()));
        assertEquals(big(1000), f.staking.getTotalStakedAmount());
    }

    @Test
    void testTwoPoolPayoutsInOneBatchShareFreeBalance() {
        f.stake(alice, 600);
        f.stake(bob, 400);
        f.token.mint(ENGINE, big(100));

        TransferPayload first = transfer(alice, ENGINE, outsider.address(), 60, List.of(), 1);
        TransferPayload second = transfer(alice, ENGINE, outsider.address(), 60, List.of(), 2);
        assertError(ErrorType.FORBIDDEN, null, () -> voting.transfer(List.of(first, second),
                List.of(alice.sign(f.domain, first), alice.sign(f.domain, second))));

        // 整批回滚：第一行的支付未结算，nonce未消费
        assertEquals(BigInteger.ZERO, f.token.balanceOf(outsider.address()));
        assertFalse(f.replayGuard.isUsed(outsider.address(), big(1)));
        assertNull(voting.getTopic(first));
    }

    @Test
    void testStakerTransferToEngineStaysInPool() {
        f.stake(alice, 600);
        f.stake(bob, 400);
        TransferPayload slash = transfer(alice, bob.address(), ENGINE, 100, List.of(), 1);
        voting.transfer(List.of(slash), List.of(alice.sign(f.domain, slash)));

        assertEquals(big(300), f.staking.getStake(bob.address()).getAmount());
        assertEquals(big(100), f.staking.getFreePoolBalance());
        assertEquals(big(1000), f.token.balanceOf(ENGINE));
        assertEquals(big(900), f.staking.getTotalVotingPower());
    }

    @Test
    void testStakerTransferRequiresCollateral() {
        f.stake(alice, 600);
        f.stake(bob, 400);
        TransferPayload missingNft = transfer(alice, bob.address(), COLLECTOR, 0, List.of(99L), 1);
        assertError(ErrorType.FORBIDDEN, null,
                () -> voting.transfer(List.of(missingNft), List.of(alice.sign(f.domain, missingNft))));

        TransferPayload tooMuch = transfer(alice, bob.address(), COLLECTOR, 401, List.of(), 2);
        assertError(ErrorType.FORBIDDEN, null,
                () -> voting.transfer(List.of(tooMuch), List.of(alice.sign(f.domain, tooMuch))));
        assertEquals(big(400), f.staking.getStake(bob.address()).getAmount());
    }

    @Test
    void testSlashingStakedNft() {
        f.stakeWithNft(alice, 500, 7L, 100);
        f.stake(bob, 400);
        TransferPayload slash = transfer(alice, alice.address(), COLLECTOR, 0, List.of(7L), 1);
        voting.transfer(List.of(slash), List.of(alice.sign(f.domain, slash)));

        assertEquals(COLLECTOR, f.nft.ownerOf(7L));
        assertEquals(big(500), f.staking.getVotingPower(alice.address()));
        assertEquals(big(900), f.staking.getTotalVotingPower());
        assertEquals(f.recomputedPool(alice, bob), f.staking.getTotalVotingPower());
    }

    // ==================== 阈值与过期 ====================

    @Test
    void testThresholdBoundary() {
        f.stake(alice, 509);
        f.stake(bob, 490);
        f.stake(carol, 1);
        assertEquals(big(510), voting.getConsensusThreshold());

        PriceUpdatePayload byAlice = prices(alice, List.of(77L), List.of(5L), 1);
        TopicRecord afterAlice = voting.setNftPrices(List.of(byAlice), List.of(alice.sign(f.domain, byAlice))).get(0);
        assertFalse(afterAlice.isAccepted());
        assertEquals(big(509), afterAlice.getVotedPower());
        assertEquals(BigInteger.ZERO, f.staking.getNftPrice(77L));

        PriceUpdatePayload byCarol = prices(carol, List.of(77L), List.of(5L), 1);
        TopicRecord afterCarol = voting.setNftPrices(List.of(byCarol), List.of(carol.sign(f.domain, byCarol))).get(0);
        assertTrue(afterCarol.isAccepted());
        assertEquals(big(510), afterCarol.getVotedPower());
        assertEquals(big(5), f.staking.getNftPrice(77L));
        assertEquals(big(5), f.oracle.getPrice(77L));
    }

    @Test
    void testExpirationBoundary() {
        f.stake(alice, 600);
        f.stake(bob, 200);
        f.stake(carol, 200);

        PriceUpdatePayload byBob = prices(bob, List.of(1L), List.of(3L), 1);
        voting.setNftPrices(List.of(byBob), List.of(bob.sign(f.domain, byBob)));

        f.clock.set(START + DAY);
        PriceUpdatePayload byCarol = prices(carol, List.of(1L), List.of(3L), 1);
        TopicRecord lastSecond = voting.setNftPrices(List.of(byCarol), List.of(carol.sign(f.domain, byCarol))).get(0);
        assertEquals(big(400), lastSecond.getVotedPower());
        assertEquals(START, lastSecond.getFirstSeen());

        f.clock.set(START + DAY + 1);
        PriceUpdatePayload byAlice = prices(alice, List.of(1L), List.of(3L), 1);
        assertError(ErrorType.TOPIC_EXPIRED, 0,
                () -> voting.setNftPrices(List.of(byAlice), List.of(alice.sign(f.domain, byAlice))));
        assertFalse(voting.getTopic(byAlice).isAccepted());
        assertEquals(big(400), voting.getTopic(byAlice).getVotedPower());
    }

    @Test
    void testStakeMustOutliveTopic() {
        f.stake(alice, 600);
        f.stake(bob, 200, DAY);
        f.stake(carol, 200, DAY + 1);

        PriceUpdatePayload byBob = prices(bob, List.of(1L), List.of(3L), 1);
        assertError(ErrorType.STAKE_EXPIRES_BEFORE_VOTE, 0,
                () -> voting.setNftPrices(List.of(byBob), List.of(bob.sign(f.domain, byBob))));
        assertNull(voting.getTopic(byBob));

        PriceUpdatePayload byCarol = prices(carol, List.of(1L), List.of(3L), 1);
        assertEquals(big(200),
                voting.setNftPrices(List.of(byCarol), List.of(carol.sign(f.domain, byCarol))).get(0).getVotedPower());
    }

    // ==================== 投票者校验 ====================

    @Test
    void testDuplicateVoteIsIgnored() {
        f.stake(alice, 600);
        f.stake(bob, 200);
        f.stake(carol, 200);

        PriceUpdatePayload byBob = prices(bob, List.of(1L), List.of(3L), 1);
        Signature sig = bob.sign(f.domain, byBob);
        List<TopicRecord> results = voting.setNftPrices(List.of(byBob, byBob), List.of(sig, sig));
        assertEquals(big(200), results.get(1).getVotedPower());
        assertEquals(1, results.get(1).getVoters().size());

        voting.setNftPrices(List.of(byBob), List.of(sig));
        assertEquals(big(200), voting.getTopic(byBob).getVotedPower());
        assertTrue(voting.hasVoted(byBob, bob.address()));
        assertFalse(voting.hasVoted(byBob, carol.address()));
    }

    @Test
    void testInvalidSignatureRollsBackWholeBatch() {
        f.stake(alice, 600);
        f.stake(bob, 400);

        PriceUpdatePayload accepted = prices(alice, List.of(5L), List.of(9L), 1);
        PriceUpdatePayload forged = prices(alice, List.of(6L), List.of(9L), 1);
        StakingException e = assertThrows(StakingException.class, () -> voting.setNftPrices(
                List.of(accepted, forged),
                List.of(alice.sign(f.domain, accepted), carol.sign(f.domain, forged))));
        assertEquals(ErrorType.INVALID_SIGNATURE, e.getErrorType());
        assertEquals(Integer.valueOf(1), e.getIndex());

        assertNull(voting.getTopic(accepted));
        assertEquals(BigInteger.ZERO, f.staking.getNftPrice(5L));
        assertEquals(BigInteger.ZERO, f.oracle.getPrice(5L));
    }

    @Test
    void testSignatureFromOtherDomainRejected() {
        f.stake(alice, 600);
        PriceUpdatePayload p = prices(alice, List.of(5L), List.of(9L), 1);
        Signature foreign = alice.sign(new EngineDomain("Unchained", "2", 31337L, ENGINE), p);
        assertError(ErrorType.INVALID_SIGNATURE, 0, () -> voting.setNftPrices(List.of(p), List.of(foreign)));
    }

    @Test
    void testVoterWithoutStake() {
        f.stake(alice, 600);
        PriceUpdatePayload p = prices(outsider, List.of(5L), List.of(9L), 1);
        assertError(ErrorType.VOTING_POWER_ZERO, 0,
                () -> voting.setNftPrices(List.of(p), List.of(outsider.sign(f.domain, p))));
    }

    @Test
    void testBatchLevelChecks() {
        f.stake(alice, 600);
        PriceUpdatePayload p = prices(alice, List.of(5L), List.of(9L), 1);
        assertError(ErrorType.LENGTH_MISMATCH, null, () -> voting.setNftPrices(List.of(p), List.of()));

        PriceUpdatePayload uneven = new PriceUpdatePayload(alice.address(), List.of(1L, 2L), List.of(big(1)), big(1));
        assertError(ErrorType.LENGTH_MISMATCH, null,
                () -> voting.setNftPrices(List.of(uneven), List.of(alice.sign(f.domain, uneven))));

        f.properties.setActivationTime(START + 100);
        assertError(ErrorType.FORBIDDEN, null,
                () -> voting.setNftPrices(List.of(p), List.of(alice.sign(f.domain, p))));
        f.clock.set(START + 100);
        assertTrue(voting.setNftPrices(List.of(p), List.of(alice.sign(f.domain, p))).get(0).isAccepted());
    }

    @Test
    void testNegativeAmountForbidden() {
        f.stake(alice, 600);
        TransferPayload negative = new TransferPayload(alice.address(), alice.address(), COLLECTOR,
                big(-1), List.of(), List.of(big(1)));
        assertError(ErrorType.FORBIDDEN, null,
                () -> voting.transfer(List.of(negative), List.of(Signature.of(BigInteger.ONE, BigInteger.ONE, 27))));
    }

    // ==================== 代理签名 ====================

    @Test
    void testDelegateVotesForStaker() {
        f.stake(alice, 600);
        f.stake(bob, 200);
        f.stake(carol, 200);
        bindDelegate(bob, delegate);
        assertEquals(delegate.address(), voting.delegateOf(bob.address()));
        assertEquals(bob.address(), voting.stakerOfDelegate(delegate.address()));

        PriceUpdatePayload p = prices(bob, List.of(1L), List.of(3L), 1);
        TopicRecord topic = voting.setNftPrices(List.of(p), List.of(delegate.sign(f.domain, p))).get(0);
        assertTrue(topic.hasVoted(bob.address()));
        assertFalse(topic.hasVoted(delegate.address()));
        assertEquals(big(200), topic.getVotedPower());

        // 质押者本人再签一次视为重复投票
        voting.setNftPrices(List.of(p), List.of(bob.sign(f.domain, p)));
        assertEquals(big(200), voting.getTopic(p).getVotedPower());
    }

    @Test
    void testSetSignerHandshakeErrors() {
        f.stake(bob, 200);
        SignerPayload p = new SignerPayload(bob.address(), delegate.address());

        assertError(ErrorType.INVALID_SIGNATURE, 0,
                () -> voting.setSigner(p, carol.sign(f.domain, p), delegate.sign(f.domain, p)));
        assertError(ErrorType.INVALID_SIGNATURE, 1,
                () -> voting.setSigner(p, bob.sign(f.domain, p), carol.sign(f.domain, p)));
        assertNull(voting.delegateOf(bob.address()));

        bindDelegate(bob, delegate);
        SignerPayload steal = new SignerPayload(carol.address(), delegate.address());
        assertError(ErrorType.DELEGATE_ADDRESS_IN_USE, null,
                () -> voting.setSigner(steal, carol.sign(f.domain, steal), delegate.sign(f.domain, steal)));
        assertEquals(bob.address(), voting.stakerOfDelegate(delegate.address()));
    }

    @Test
    void testReplacingDelegateRevokesPrevious() {
        f.stake(alice, 600);
        f.stake(bob, 400);
        bindDelegate(bob, delegate);
        bindDelegate(bob, otherDelegate);
        assertEquals(otherDelegate.address(), voting.delegateOf(bob.address()));
        assertNull(voting.stakerOfDelegate(delegate.address()));

        PriceUpdatePayload p = prices(bob, List.of(1L), List.of(3L), 1);
        assertError(ErrorType.INVALID_SIGNATURE, 0,
                () -> voting.setNftPrices(List.of(p), List.of(delegate.sign(f.domain, p))));
    }

    @Test
    void testAlternateAddressBinding() {
        f.stake(bob, 400);
        Address alternate = outsider.address();
        voting.setAlternateAddress(bob.address(), alternate);
        assertEquals(f.staking.getStake(bob.address()), f.staking.getStakeByAlternate(alternate));

        assertError(ErrorType.ADDRESS_IN_USE, null, () -> voting.setAlternateAddress(carol.address(), alternate));
    }

    // ==================== 价格与参数 ====================

    @Test
    void testPriceUpdateAdjustsPoolForStakedNft() {
        f.stakeWithNft(alice, 500, 7L, 100);
        f.stake(bob, 400);
        assertEquals(big(1000), f.staking.getTotalVotingPower());

        PriceUpdatePayload p = prices(alice, List.of(7L, 8L), List.of(150L, 20L), 1);
        voting.setNftPrices(List.of(p), List.of(alice.sign(f.domain, p)));

        assertEquals(big(1050), f.staking.getTotalVotingPower());
        assertEquals(big(650), f.staking.getVotingPower(alice.address()));
        assertEquals(big(150), f.oracle.getPrice(7L));
        assertEquals(big(20), f.staking.getNftPrice(8L));
        assertEquals(f.recomputedPool(alice, bob), f.staking.getTotalVotingPower());
    }

    @Test
    void testParameterChange() {
        f.stake(alice, 600);
        f.stake(bob, 400);
        ParamsPayload p = params(alice, 60, 3600, 1);
        assertTrue(voting.setParams(List.of(p), List.of(alice.sign(f.domain, p))).get(0).isAccepted());

        GlobalParams current = voting.getParams();
        assertEquals(60, current.getThreshold());
        assertEquals(3600L, current.getExpiration());
        assertEquals(1L, current.getVersion());
        assertEquals(big(600), voting.getConsensusThreshold());

        // 重复提交已通过的议题不会再次修改参数
        voting.setParams(List.of(p), List.of(alice.sign(f.domain, p)));
        assertEquals(1L, voting.getParams().getVersion());
    }

    @Test
    void testInvalidParameterChangeForbidden() {
        f.stake(alice, 600);
        f.stake(bob, 400);
        ParamsPayload zeroThreshold = params(alice, 0, 3600, 1);
        assertError(ErrorType.FORBIDDEN, null,
                () -> voting.setParams(List.of(zeroThreshold), List.of(alice.sign(f.domain, zeroThreshold))));

        ParamsPayload unknownToken = new ParamsPayload(alice.address(), COLLECTOR, NFT, TRACKER,
                big(51), big(3600), COLLECTOR, big(2));
        assertError(ErrorType.FORBIDDEN, null,
                () -> voting.setParams(List.of(unknownToken), List.of(alice.sign(f.domain, unknownToken))));

        assertEquals(0L, voting.getParams().getVersion());
        assertNull(voting.getTopic(zeroThreshold));
    }

    @Test
    void testExpirationIsCapped() {
        f.stake(alice, 600, ParameterStore.MAX_EXPIRATION + 2 * DAY);
        f.stake(bob, 400);

        ParamsPayload forever = params(alice, 51, Long.MAX_VALUE, 1);
        assertError(ErrorType.FORBIDDEN, null,
                () -> voting.setParams(List.of(forever), List.of(alice.sign(f.domain, forever))));
        ParamsPayload justOver = params(alice, 51, ParameterStore.MAX_EXPIRATION + 1, 2);
        assertError(ErrorType.FORBIDDEN, null,
                () -> voting.setParams(List.of(justOver), List.of(alice.sign(f.domain, justOver))));
        assertEquals(0L, voting.getParams().getVersion());

        ParamsPayload longest = params(alice, 51, ParameterStore.MAX_EXPIRATION, 3);
        assertTrue(voting.setParams(List.of(longest), List.of(alice.sign(f.domain, longest))).get(0).isAccepted());
        assertEquals(ParameterStore.MAX_EXPIRATION, voting.getParams().getExpiration());

        // 上限内的有效期下投票仍然可用
        PriceUpdatePayload byAlice = prices(alice, List.of(1L), List.of(3L), 1);
        TopicRecord accepted = voting.setNftPrices(List.of(byAlice), List.of(alice.sign(f.domain, byAlice))).get(0);
        assertTrue(accepted.isAccepted());

        PriceUpdatePayload byBob = prices(bob, List.of(2L), List.of(3L), 2);
        assertError(ErrorType.STAKE_EXPIRES_BEFORE_VOTE, 0,
                () -> voting.setNftPrices(List.of(byBob), List.of(bob.sign(f.domain, byBob))));

        // 截止时间饱和而不是回绕
        assertEquals(Long.MAX_VALUE, accepted.deadline(Long.MAX_VALUE));
    }

    @Test
    void testSwitchPriceOracle() {
        Address trackerAddress = Address.fromHex("0x000000000000000000000000000000000007eac4");
        MemoryPriceOracle tracker = new MemoryPriceOracle(trackerAddress);
        f.directory.register(tracker);
        f.stakeWithNft(alice, 500, 7L, 100);
        f.stake(bob, 400);

        ParamsPayload unknown = new ParamsPayload(alice.address(), TOKEN, NFT, COLLECTOR,
                big(51), big(3600), COLLECTOR, big(1));
        assertError(ErrorType.FORBIDDEN, null,
                () -> voting.setParams(List.of(unknown), List.of(alice.sign(f.domain, unknown))));

        ParamsPayload p = new ParamsPayload(alice.address(), TOKEN, NFT, trackerAddress,
                big(51), big(3600), COLLECTOR, big(2));
        assertTrue(voting.setParams(List.of(p), List.of(alice.sign(f.domain, p))).get(0).isAccepted());
        assertEquals(trackerAddress, voting.getParams().getNftTracker());

        // 新抵押的NFT从新预言机读价，通过的价格同步到新预言机
        tracker.setPrice(8L, big(40));
        f.nft.mint(bob.address(), 8L);
        f.staking.increaseStake(bob.address(), BigInteger.ZERO, List.of(8L));
        assertEquals(big(40), f.staking.getNftPrice(8L));

        PriceUpdatePayload update = prices(alice, List.of(7L), List.of(150L), 1);
        voting.setNftPrices(List.of(update), List.of(alice.sign(f.domain, update)));
        assertEquals(big(150), tracker.getPrice(7L));
        assertEquals(big(100), f.oracle.getPrice(7L));
    }

    @Test
    void testBatchUsesOneParameterSnapshot() {
        f.stake(alice, 600);
        f.stake(bob, 400);
        ParamsPayload unanimous = params(alice, 100, 3600, 1);
        ParamsPayload next = params(alice, 70, 3600, 2);
        voting.setParams(List.of(unanimous, next),
                List.of(alice.sign(f.domain, unanimous), alice.sign(f.domain, next)));

        // 第二行仍按批次开始时的51%判定
        assertEquals(2L, voting.getParams().getVersion());
        assertEquals(70, voting.getParams().getThreshold());
    }

    // ==================== 工具方法 ====================

    private void bindDelegate(TestSigner staker, TestSigner signer) {
        SignerPayload p = new SignerPayload(staker.address(), signer.address());
        voting.setSigner(p, staker.sign(f.domain, p), signer.sign(f.domain, p));
    }

    private static TransferPayload transfer(TestSigner signer, Address from, Address to, long amount,
                                            List<Long> nftIds, long nonce) {
        return new TransferPayload(signer.address(), from, to, big(amount), nftIds, List.of(big(nonce)));
    }

    private static PriceUpdatePayload prices(TestSigner signer, List<Long> ids, List<Long> values, long nonce) {
        List<BigInteger> converted = new ArrayList<>();
        for (Long value : values) {
            converted.add(big(value));
        }
        return new PriceUpdatePayload(signer.address(), ids, converted, big(nonce));
    }

    private static ParamsPayload params(TestSigner signer, long threshold, long expiration, long nonce) {
        return new ParamsPayload(signer.address(), TOKEN, NFT, TRACKER, big(threshold), big(expiration), COLLECTOR, big(nonce));
    }

    private static void assertError(ErrorType expected, Integer index, Executable call) {
        StakingException e = assertThrows(StakingException.class, call);
        log.info("预期拒绝: {}", e.getMessage());
        assertEquals(expected, e.getErrorType());
        if (index != null) {
            assertEquals(index, e.getIndex());
        }
    }
}
