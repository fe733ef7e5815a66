package cn.lihongjie.hashwork.core;

import cn.lihongjie.hashwork.MutableClock;
import cn.lihongjie.hashwork.codec.ChallengeTokenCodec;
import cn.lihongjie.hashwork.codec.ProofMessageCodec;
import cn.lihongjie.hashwork.config.ValidatorConfig;
import cn.lihongjie.hashwork.exception.ProtocolException;
import cn.lihongjie.hashwork.model.Challenge;
import cn.lihongjie.hashwork.model.ChallengeClass;
import cn.lihongjie.hashwork.model.MinerSnapshot;
import cn.lihongjie.hashwork.model.Proof;
import cn.lihongjie.hashwork.model.Score;
import cn.lihongjie.hashwork.model.VerificationOutcome;
import cn.lihongjie.hashwork.store.CheckpointStore;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * 验证方编排服务测试
 *
 * @author lihongjie
 */
public class ValidatorServiceTest {

    private static final Logger log = LoggerFactory.getLogger(ValidatorServiceTest.class);

    private static final String SECRET_KEY = "ThisIsAVerySecureSecretKeyWith256Bits!!";

    private static final long START = 1_700_000_000_000L;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ValidatorConfig config;
    private ChallengeTokenCodec tokenCodec;
    private ProofMessageCodec proofCodec;
    private MutableClock clock;
    private ValidatorService service;

    @Before
    public void setUp() {
        // 所有类别的有效目标都不低于 0x0fffffff，平均 16 次哈希即可命中
        config = ValidatorConfig.builder()
                .difficultyBounds(0x0fffffffL, 0xffffffffL)
                .initialDifficultyTarget(0x0fffffffL)
                .build();
        tokenCodec = new ChallengeTokenCodec(SECRET_KEY);
        proofCodec = new ProofMessageCodec();
        clock = new MutableClock(START);
        service = newService(clock, null);
    }

    @After
    public void tearDown() {
        service.close();
    }

    private ValidatorService newService(Clock serviceClock, CheckpointStore store) {
        return new ValidatorService(config, tokenCodec, store, serviceClock, new Random(3));
    }

    private static long solve(Challenge challenge) {
        byte[] payload = ProofHash.hexToBytes(challenge.getPayloadHex());
        for (long nonce = 0; ; nonce++) {
            if (ProofHash.verify(payload, nonce, challenge.getDifficultyTarget())) {
                return nonce;
            }
        }
    }

    private static long unsolve(Challenge challenge) {
        byte[] payload = ProofHash.hexToBytes(challenge.getPayloadHex());
        for (long nonce = 0; ; nonce++) {
            if (!ProofHash.verify(payload, nonce, challenge.getDifficultyTarget())) {
                return nonce;
            }
        }
    }

    private String proofMessage(Challenge challenge, long nonce) {
        return proofCodec.encode(new Proof(challenge.getId(), nonce, 100L, "software", 0L));
    }

    private Score acceptAfter(ValidatorService target, Challenge challenge, String minerId, long elapsedMs) {
        clock.advance(elapsedMs);
        return target.submit(minerId, proofMessage(challenge, solve(challenge))).join();
    }

    /**
     * 新矿工第 3 个 Standard 挑战 2500ms 完成：评分与权重都严格高于同样表现的老矿工
     */
    @Test
    public void testNewcomerOutranksVeteranWithIdenticalProof() {
        log.info("=== Test: Newcomer Versus Veteran ===");

        ValidatorConfig standardOnly = config.toBuilder()
                .classWeight(ChallengeClass.STANDARD, 1.0)
                .classWeight(ChallengeClass.HIGH_DIFFICULTY, 0.0)
                .classWeight(ChallengeClass.TIME_PRESSURE, 0.0)
                .classWeight(ChallengeClass.EFFICIENCY_TEST, 0.0)
                .networkClassShift(0.0)
                .build();
        try (ValidatorService validator = new ValidatorService(standardOnly, tokenCodec, null, clock, new Random(5))) {
            for (int i = 0; i < 20; i++) {
                Score score = acceptAfter(validator, validator.issueChallenge("veteran"), "veteran", 2_500L);
                assertEquals(VerificationOutcome.ACCEPTED, score.getOutcome());
            }
            for (int i = 0; i < 2; i++) {
                Score score = acceptAfter(validator, validator.issueChallenge("newcomer"), "newcomer", 2_500L);
                assertEquals(VerificationOutcome.ACCEPTED, score.getOutcome());
            }
            validator.closeEpoch();

            Challenge veteranChallenge = validator.issueChallenge("veteran");
            Challenge newcomerChallenge = validator.issueChallenge("newcomer");
            assertEquals(ChallengeClass.STANDARD, veteranChallenge.getChallengeClass());
            assertEquals(ChallengeClass.STANDARD, newcomerChallenge.getChallengeClass());
            assertEquals(veteranChallenge.getDifficultyTarget(), newcomerChallenge.getDifficultyTarget());

            clock.advance(2_500L);
            Score veteran = validator.submit("veteran",
                    proofMessage(veteranChallenge, solve(veteranChallenge))).join();
            Score newcomer = validator.submit("newcomer",
                    proofMessage(newcomerChallenge, solve(newcomerChallenge))).join();
            log.info("Veteran: {}", veteran);
            log.info("Newcomer: {}", newcomer);

            assertEquals(0.25, veteran.getBonus().getSpeed(), 1e-9);
            assertEquals(0.25, newcomer.getBonus().getSpeed(), 1e-9);
            assertEquals(0.2, veteran.getBonus().getHistorical(), 1e-9);
            assertEquals(0.0, veteran.getBonus().getEarlyDetection(), 1e-9);
            assertTrue(newcomer.getBonus().getEarlyDetection() > 0.0);
            assertTrue("Newcomer final score must exceed the veteran's", newcomer.getFinal() > veteran.getFinal());

            EpochWeights weights = validator.closeEpoch();
            assertTrue(weights.getEarlyBonusMiners().contains("newcomer"));
            assertFalse(weights.getEarlyBonusMiners().contains("veteran"));
            assertTrue("Newcomer weight must exceed the veteran's",
                    weights.getWeight("newcomer") > weights.getWeight("veteran"));
        }

        log.info("=== Test PASSED ===\n");
    }

    private Score failOnce(String minerId) {
        Challenge challenge = service.issueChallenge(minerId);
        return service.submit(minerId, proofMessage(challenge, unsolve(challenge))).join();
    }

    /**
     * 全网成功率越过性能带：类别抽样表在 standard 与 high_difficulty 间移动 0.2
     */
    @Test
    public void testNetworkSuccessShiftsClassMix() {
        log.info("=== Test: Network Class Mix ===");

        assertEquals(NetworkClassBalancer.Band.NORMAL, service.getNetworkBand());
        assertEquals(0.4, service.classProbability(ChallengeClass.STANDARD), 1e-9);
        assertEquals(0.2, service.classProbability(ChallengeClass.HIGH_DIFFICULTY), 1e-9);

        Challenge first = service.issueChallenge("miner-1");
        assertTrue(service.submit("miner-1", proofMessage(first, solve(first))).join().getOutcome().isAccepted());
        assertEquals(NetworkClassBalancer.Band.HIGH, service.getNetworkBand());
        assertEquals(0.2, service.classProbability(ChallengeClass.STANDARD), 1e-9);
        assertEquals(0.4, service.classProbability(ChallengeClass.HIGH_DIFFICULTY), 1e-9);
        assertEquals(0.2, service.getClassWeights().get(ChallengeClass.STANDARD), 1e-9);

        // 失败来自不同矿工，同样计入全网成功率
        for (int i = 0; i < 3; i++) {
            assertEquals(VerificationOutcome.INVALID, failOnce("miner-" + (i % 2 + 2)).getOutcome());
        }
        assertEquals(NetworkClassBalancer.Band.NORMAL, service.getNetworkBand());
        assertEquals(0.4, service.classProbability(ChallengeClass.STANDARD), 1e-9);

        for (int i = 0; i < 9; i++) {
            failOnce("miner-2");
        }
        assertEquals(NetworkClassBalancer.Band.LOW, service.getNetworkBand());
        assertEquals(0.6, service.classProbability(ChallengeClass.STANDARD), 1e-9);
        assertEquals(0.0, service.classProbability(ChallengeClass.HIGH_DIFFICULTY), 1e-9);
        for (int i = 0; i < 50; i++) {
            assertNotEquals(ChallengeClass.HIGH_DIFFICULTY, service.issueChallenge("miner-4").getChallengeClass());
        }

        // 新基准上继续叠加当前区间的偏移
        service.updateClassWeights(config.toBuilder()
                .classWeight(ChallengeClass.STANDARD, 0.25)
                .classWeight(ChallengeClass.HIGH_DIFFICULTY, 0.25)
                .classWeight(ChallengeClass.TIME_PRESSURE, 0.25)
                .classWeight(ChallengeClass.EFFICIENCY_TEST, 0.25)
                .build());
        assertEquals(0.45, service.classProbability(ChallengeClass.STANDARD), 1e-9);
        assertEquals(0.05, service.classProbability(ChallengeClass.HIGH_DIFFICULTY), 1e-9);

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 签发 → 矿工解析求解 → 提交 → 评分 → epoch 权重
     */
    @Test
    public void testEndToEnd() {
        log.info("=== Test: End To End ===");

        String token = service.issue("miner-1");
        Challenge challenge = tokenCodec.decode(token,
                Collections.singletonMap(ChallengeTokenCodec.CONTEXT_MINER, "miner-1"));
        log.info("Issued: {}", challenge);

        clock.advance(300);
        Score score = service.submit("miner-1", proofMessage(challenge, solve(challenge))).join();
        assertEquals(VerificationOutcome.ACCEPTED, score.getOutcome());
        assertTrue(score.getFinal() >= 1.0);
        assertTrue(score.getFinal() <= config.getCapTotal());

        MinerSnapshot snapshot = service.snapshot("miner-1").orElseThrow(AssertionError::new);
        assertEquals(1L, snapshot.getChallengeCount());
        assertEquals(1L, snapshot.getAcceptedCount());
        assertEquals(Collections.singletonList(300L), snapshot.getRecentElapsedMs());

        EpochWeights weights = service.closeEpoch();
        assertEquals(1L, weights.getEpoch());
        assertEquals(1.0, weights.getWeight("miner-1"), 1e-9);

        log.info("=== Test PASSED ===\n");
    }

    @Test
    public void testChallengeTokenIsBoundToMiner() {
        log.info("=== Test: Token Bound To Miner ===");

        String token = service.issue("miner-1");
        try {
            tokenCodec.decode(token, Collections.singletonMap(ChallengeTokenCodec.CONTEXT_MINER, "miner-2"));
            fail("Token issued to miner-1 must not validate for miner-2");
        } catch (ProtocolException e) {
            log.info("Context mismatch detected: {}", e.getMessage());
        }

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 格式错误的消息以 ProtocolException 失败，不影响矿工状态
     */
    @Test
    public void testMalformedMessageIsDropped() {
        log.info("=== Test: Malformed Message ===");

        CompletableFuture<Score> future = service.submit("miner-1", "{not json");
        assertTrue(future.isCompletedExceptionally());
        try {
            future.join();
            fail("Malformed message should fail");
        } catch (CompletionException e) {
            assertTrue(e.getCause() instanceof ProtocolException);
        }
        assertEquals(0, service.trackedMiners());

        log.info("=== Test PASSED ===\n");
    }

    @Test
    public void testDuplicateAndInvalidAreRecorded() {
        log.info("=== Test: Duplicate And Invalid ===");

        Challenge first = service.issueChallenge("miner-1");
        String message = proofMessage(first, solve(first));
        assertTrue(service.submit("miner-1", message).join().getOutcome().isAccepted());

        Score duplicate = service.submit("miner-1", message).join();
        assertEquals(VerificationOutcome.DUPLICATE, duplicate.getOutcome());
        assertEquals(0.0, duplicate.getFinal(), 0.0);

        Challenge second = service.issueChallenge("miner-1");
        Score invalid = service.submit("miner-1", proofMessage(second, unsolve(second))).join();
        assertEquals(VerificationOutcome.INVALID, invalid.getOutcome());

        MinerSnapshot snapshot = service.snapshot("miner-1").orElseThrow(AssertionError::new);
        assertEquals(3L, snapshot.getChallengeCount());
        assertEquals(1L, snapshot.getAcceptedCount());
        assertEquals(3L, snapshot.getSubmittedCount());

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 未被跟踪的矿工提交未知 Challenge：Stale、零分，不建立记录
     */
    @Test
    public void testUntrackedStaleProofIsNotTracked() {
        log.info("=== Test: Untracked Stale ===");

        Score score = service.submit("stranger", new Proof("unknown", 1L, 1L, "x", 0L)).join();
        assertEquals(VerificationOutcome.STALE, score.getOutcome());
        assertEquals(0.0, score.getFinal(), 0.0);
        assertEquals(0, service.trackedMiners());
        assertFalse(service.snapshot("stranger").isPresent());

        log.info("=== Test PASSED ===\n");
    }

    @Test
    public void testOverdueChallengesExpire() {
        log.info("=== Test: Expiry ===");

        Challenge challenge = service.issueChallenge("miner-1");
        clock.advance(challenge.getTimeoutMillis() + config.getGracePeriodMillis());
        assertTrue(service.expireOverdue().isEmpty());

        clock.advance(1);
        List<Score> expired = service.expireOverdue();
        assertEquals(1, expired.size());
        assertEquals(VerificationOutcome.EXPIRED, expired.get(0).getOutcome());
        assertEquals(0.0, expired.get(0).getFinal(), 0.0);

        MinerSnapshot snapshot = service.snapshot("miner-1").orElseThrow(AssertionError::new);
        assertEquals(1L, snapshot.getChallengeCount());
        assertEquals(0L, snapshot.getSubmittedCount());

        // 过期后再提交为 Stale
        Score stale = service.submit("miner-1", proofMessage(challenge, solve(challenge))).join();
        assertEquals(VerificationOutcome.STALE, stale.getOutcome());

        log.info("=== Test PASSED ===\n");
    }

    @Test
    public void testLateSubmission() {
        log.info("=== Test: Late Submission ===");

        Challenge challenge = service.issueChallenge("miner-1");
        clock.advance(challenge.getTimeoutMillis() + config.getGracePeriodMillis() + 1);

        Score score = service.submit("miner-1", proofMessage(challenge, solve(challenge))).join();
        assertEquals(VerificationOutcome.LATE, score.getOutcome());
        assertTrue("Late challenge is already terminal", service.expireOverdue().isEmpty());

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 多矿工并发提交（期间穿插 epoch 结算）：每个结论都恰好计入一次
     */
    @Test
    public void testConcurrentSubmissionsAreNotLost() throws Exception {
        log.info("=== Test: Concurrent Submissions ===");

        int miners = 4;
        int perMiner = 25;
        List<String> messages = new ArrayList<>();
        List<String> owners = new ArrayList<>();
        for (int m = 0; m < miners; m++) {
            String minerId = "miner-" + m;
            for (int i = 0; i < perMiner; i++) {
                Challenge challenge = service.issueChallenge(minerId);
                messages.add(proofMessage(challenge, solve(challenge)));
                owners.add(minerId);
            }
        }

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Score>> futures = new ArrayList<>();
            for (int i = 0; i < messages.size(); i++) {
                String minerId = owners.get(i);
                String message = messages.get(i);
                futures.add(pool.submit(() -> service.submit(minerId, message).join()));
                if (i % 20 == 0) {
                    pool.submit(service::closeEpoch);
                }
            }
            for (Future<Score> future : futures) {
                assertEquals(VerificationOutcome.ACCEPTED, future.get(30, TimeUnit.SECONDS).getOutcome());
            }
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        }

        for (int m = 0; m < miners; m++) {
            MinerSnapshot snapshot = service.snapshot("miner-" + m).orElseThrow(AssertionError::new);
            assertEquals(perMiner, snapshot.getChallengeCount());
            assertEquals(perMiner, snapshot.getAcceptedCount());
        }
        EpochWeights weights = service.closeEpoch();
        assertEquals(1.0, weights.total(), 1e-9);
        assertEquals(miners, weights.getWeights().size());

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 检查点：关闭时落盘，重启后恢复矿工状态与 epoch 计数
     */
    @Test
    public void testCheckpointRestore() throws Exception {
        log.info("=== Test: Checkpoint Restore ===");

        CheckpointStore store = new CheckpointStore(folder.getRoot().toPath().resolve("state/checkpoint.json"));
        MinerSnapshot before;
        long epoch;
        try (ValidatorService first = newService(clock, store)) {
            for (int i = 0; i < 6; i++) {
                Challenge challenge = first.issueChallenge("miner-1");
                clock.advance(50);
                first.submit("miner-1", proofMessage(challenge, i % 3 == 0 ? unsolve(challenge) : solve(challenge)))
                        .join();
            }
            epoch = first.closeEpoch().getEpoch();
            before = first.snapshot("miner-1").orElseThrow(AssertionError::new);
        }

        try (ValidatorService second = newService(clock, store)) {
            assertEquals(1, second.trackedMiners());
            MinerSnapshot after = second.snapshot("miner-1").orElseThrow(AssertionError::new);
            assertEquals(before.getChallengeCount(), after.getChallengeCount());
            assertEquals(before.getAcceptedCount(), after.getAcceptedCount());
            assertEquals(before.getDifficultyTarget(), after.getDifficultyTarget());
            assertEquals(before.getSuccessFast(), after.getSuccessFast(), 0.0);
            assertEquals(before.getSuccessSlow(), after.getSuccessSlow(), 0.0);
            assertEquals(before.getWeightSlow(), after.getWeightSlow(), 0.0);
            assertEquals(before.getRecentElapsedMs(), after.getRecentElapsedMs());
            assertEquals(before.getConsensusWeight(), after.getConsensusWeight(), 0.0);
            assertEquals(epoch + 1, second.closeEpoch().getEpoch());
        }

        log.info("=== Test PASSED ===\n");
    }
}
