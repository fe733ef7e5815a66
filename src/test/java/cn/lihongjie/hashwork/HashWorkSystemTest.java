package cn.lihongjie.hashwork;

import cn.lihongjie.hashwork.client.MinerResponder;
import cn.lihongjie.hashwork.client.MinerResponse;
import cn.lihongjie.hashwork.client.ProofSubmitter;
import cn.lihongjie.hashwork.client.SoftwareSolver;
import cn.lihongjie.hashwork.client.device.SimulatedDeviceLink;
import cn.lihongjie.hashwork.codec.ChallengeTokenCodec;
import cn.lihongjie.hashwork.codec.ProofMessageCodec;
import cn.lihongjie.hashwork.config.MinerConfig;
import cn.lihongjie.hashwork.config.ValidatorConfig;
import cn.lihongjie.hashwork.core.EpochWeights;
import cn.lihongjie.hashwork.core.ValidatorService;
import cn.lihongjie.hashwork.model.MinerSnapshot;
import cn.lihongjie.hashwork.model.Score;
import cn.lihongjie.hashwork.model.VerificationOutcome;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.Assert.*;

/**
 * 进程内端到端测试：验证方签发 → 矿工（模拟硬件 + 软件兜底）求解 → 验证评分 → epoch 权重
 *
 * @author lihongjie
 */
public class HashWorkSystemTest {

    private static final Logger log = LoggerFactory.getLogger(HashWorkSystemTest.class);

    private static final String SECRET_KEY = "ThisIsAVerySecureSecretKeyWith256Bits!!";

    private final ProofMessageCodec proofCodec = new ProofMessageCodec();
    private final List<Score> scores = new CopyOnWriteArrayList<>();
    private final List<SimulatedDeviceLink> links = new ArrayList<>();
    private final List<ProofSubmitter> submitters = new ArrayList<>();
    private final List<MinerResponder> responders = new ArrayList<>();

    private ValidatorService validator;
    private SoftwareSolver solver;
    private MinerConfig minerConfig;

    @Before
    public void setUp() {
        // 目标下限很宽松，保证每个类别都能在毫秒级解出
        ValidatorConfig config = ValidatorConfig.builder()
                .difficultyBounds(0x0fffffffL, 0xffffffffL)
                .initialDifficultyTarget(0x0fffffffL)
                .build();
        validator = new ValidatorService(config, new ChallengeTokenCodec(SECRET_KEY), null,
                Clock.systemUTC(), new SecureRandom());
        minerConfig = MinerConfig.builder()
                .pollIntervalMillis(5)
                .softwareThreads(2)
                .hashCheckInterval(256)
                .build();
        solver = new SoftwareSolver(minerConfig, Clock.systemUTC());
    }

    @After
    public void tearDown() {
        for (ProofSubmitter submitter : submitters) {
            submitter.close();
        }
        for (MinerResponder responder : responders) {
            responder.close();
        }
        for (SimulatedDeviceLink link : links) {
            link.close();
        }
        solver.close();
        validator.close();
    }

    private MinerResponder miner(String minerId, int units) {
        SimulatedDeviceLink link = new SimulatedDeviceLink(units);
        ProofSubmitter submitter = new ProofSubmitter(proof ->
                scores.add(validator.submit(minerId, proofCodec.encode(proof)).join()));
        MinerResponder responder = new MinerResponder(minerId, minerConfig, link, solver, submitter,
                new ChallengeTokenCodec(SECRET_KEY), Clock.systemUTC());
        links.add(link);
        submitters.add(submitter);
        responders.add(responder);
        return responder;
    }

    private void drainSubmitters() {
        for (ProofSubmitter submitter : submitters) {
            submitter.close();
        }
    }

    /**
     * 完整流程：多个矿工多轮求解，epoch 结束导出归一化权重
     */
    @Test
    public void testCompleteWorkflow() {
        log.info("=== Test: Complete Workflow ===");

        List<MinerResponder> miners = new ArrayList<>();
        miners.add(miner("miner-a", 2));
        miners.add(miner("miner-b", 1));
        miners.add(miner("miner-c", 0));

        int rounds = 4;
        for (int round = 0; round < rounds; round++) {
            for (MinerResponder responder : miners) {
                MinerResponse response = responder.respond(validator.issue(responder.getMinerId()));
                assertTrue("Round " + round + " unsolved for " + responder.getMinerId() + ": "
                        + response.getReason(), response.isSolved());
            }
        }
        drainSubmitters();

        assertEquals(rounds * miners.size(), scores.size());
        for (Score score : scores) {
            assertEquals(VerificationOutcome.ACCEPTED, score.getOutcome());
            assertTrue(score.getFinal() >= 1.0 && score.getFinal() <= 2.5);
        }

        MinerSnapshot snapshot = validator.snapshot("miner-c").orElseThrow(AssertionError::new);
        assertEquals(rounds, snapshot.getChallengeCount());
        assertEquals(rounds, snapshot.getAcceptedCount());

        EpochWeights weights = validator.closeEpoch();
        assertEquals(3, weights.getWeights().size());
        assertEquals(1.0, weights.total(), 1e-9);
        for (double weight : weights.getWeights().values()) {
            assertTrue(weight > 0.0);
        }
        // 新矿工且成功率满足阈值，全部获得早发现奖励
        assertEquals(3, weights.getEarlyBonusMiners().size());

        log.info("Epoch weights: {}", weights);
        log.info("=== Test PASSED ===\n");
    }

    /**
     * 硬件单元中途故障：转软件兜底，验证方照常接受
     */
    @Test
    public void testHardwareFaultFallsBackToSoftware() {
        log.info("=== Test: Hardware Fault Fallback ===");

        MinerResponder responder = miner("miner-a", 1);
        links.get(0).injectFault("sim-0");

        MinerResponse response = responder.respond(validator.issue("miner-a"));
        assertTrue(response.isSolved());
        assertEquals(SoftwareSolver.DEVICE_ID, response.getProof().getDeviceId());
        assertTrue(responder.getRegistry().isDegraded("sim-0"));

        drainSubmitters();
        assertEquals(1, scores.size());
        assertEquals(VerificationOutcome.ACCEPTED, scores.get(0).getOutcome());

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 重放：同一 Proof 再次提交判为 DUPLICATE，得 0 分
     */
    @Test
    public void testReplayIsDuplicate() {
        log.info("=== Test: Replay Protection ===");

        MinerResponder responder = miner("miner-a", 1);
        MinerResponse response = responder.respond(validator.issue("miner-a"));
        assertTrue(response.isSolved());
        drainSubmitters();
        assertEquals(VerificationOutcome.ACCEPTED, scores.get(0).getOutcome());

        Score replay = validator.submit("miner-a", proofCodec.encode(response.getProof())).join();
        assertEquals(VerificationOutcome.DUPLICATE, replay.getOutcome());
        assertEquals(0.0, replay.getFinal(), 0.0);

        Score stolen = validator.submit("miner-b", proofCodec.encode(response.getProof())).join();
        assertEquals(VerificationOutcome.STALE, stolen.getOutcome());
        assertFalse(validator.snapshot("miner-b").isPresent());

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 签名被篡改或来自其他验证方的 Challenge 被矿工丢弃
     */
    @Test
    public void testForeignChallengeIsDropped() {
        log.info("=== Test: Signature Tampering ===");

        MinerResponder responder = miner("miner-a", 1);
        String token = validator.issue("miner-a");
        String tampered = token.substring(0, token.length() - 5) + "AAAAA";

        MinerResponse response = responder.respond(tampered);
        assertFalse(response.isSolved());
        assertTrue(response.getReason().startsWith("malformed challenge"));

        try (ValidatorService other = new ValidatorService(ValidatorConfig.defaults(),
                "AnotherValidatorSecretKeyOf256Bits!!!!", null)) {
            assertFalse(responder.respond(other.issue("miner-a")).isSolved());
        }

        log.info("=== Test PASSED ===\n");
    }
}
