package cn.lihongjie.hashwork.client;

import cn.lihongjie.hashwork.MutableClock;
import cn.lihongjie.hashwork.client.device.DeviceJob;
import cn.lihongjie.hashwork.client.device.DeviceLink;
import cn.lihongjie.hashwork.client.device.DevicePoll;
import cn.lihongjie.hashwork.client.device.DeviceTelemetry;
import cn.lihongjie.hashwork.codec.ChallengeTokenCodec;
import cn.lihongjie.hashwork.config.MinerConfig;
import cn.lihongjie.hashwork.core.ProofHash;
import cn.lihongjie.hashwork.exception.DeviceLinkException;
import cn.lihongjie.hashwork.model.Challenge;
import cn.lihongjie.hashwork.model.ChallengeClass;
import cn.lihongjie.hashwork.model.Proof;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * 矿工响应测试（硬件故障转软件、无效 Share、过温、按时无解）
 *
 * @author lihongjie
 */
public class MinerResponderTest {

    private static final Logger log = LoggerFactory.getLogger(MinerResponderTest.class);

    private static final String SECRET_KEY = "ThisIsAVerySecureSecretKeyWith256Bits!!";
    private static final long EASY_TARGET = 0x0fffffffL;
    private static final long IMPOSSIBLE_TARGET = 1L;
    private static final String EASY_PAYLOAD =
            "a1b2c3d4e5f60718293a4b5c6d7e8f90a1b2c3d4e5f60718293a4b5c6d7e8f90";

    private MinerConfig config;
    private SoftwareSolver solver;
    private final Random random = new Random(5);
    private final List<MinerResponder> responders = new ArrayList<>();

    @Before
    public void setUp() {
        config = MinerConfig.builder()
                .safetyMarginMillis(500L)
                .pollIntervalMillis(10L)
                .reprobeIntervalMillis(30_000L)
                .softwareThreads(2)
                .hashCheckInterval(256)
                .build();
        solver = new SoftwareSolver(config, Clock.systemUTC());
    }

    @After
    public void tearDown() {
        for (MinerResponder responder : responders) {
            responder.close();
        }
        solver.close();
    }

    private MinerResponder responder(DeviceLink link, ProofSubmitter submitter, Clock clock) {
        MinerResponder responder = new MinerResponder("miner-1", config, link, solver, submitter, null, clock);
        responders.add(responder);
        return responder;
    }

    private Challenge challenge(long target, long timeoutMillis) {
        byte[] payload = new byte[32];
        random.nextBytes(payload);
        return Challenge.builder()
                .id("challenge-" + random.nextInt(1_000_000))
                .challengeClass(ChallengeClass.STANDARD)
                .difficultyTarget(target)
                .timeoutMillis(timeoutMillis)
                .issuedAt(System.currentTimeMillis())
                .payloadHex(ProofHash.bytesToHex(payload))
                .build();
    }

    private static void assertValid(Challenge challenge, Proof proof) {
        assertEquals(challenge.getId(), proof.getChallengeId());
        assertTrue("Proof must verify locally", ProofHash.verify(
                ProofHash.hexToBytes(challenge.getPayloadHex()), proof.getNonce(), challenge.getDifficultyTarget()));
    }

    @Test
    public void testHardwareSolvesAndCancelsJobs() {
        log.info("=== Test: Hardware Solve ===");

        FakeDeviceLink link = new FakeDeviceLink();
        link.add("asic-0", Mode.SOLVE);
        link.add("asic-1", Mode.SOLVE);
        List<Proof> sent = new CopyOnWriteArrayList<>();
        ProofSubmitter submitter = new ProofSubmitter(sent::add);

        Challenge challenge = challenge(EASY_TARGET, 8_000L);
        MinerResponse response = responder(link, submitter, Clock.systemUTC()).respond(challenge);
        submitter.close();

        assertTrue(response.isSolved());
        assertValid(challenge, response.getProof());
        assertTrue(response.getProof().getDeviceId().startsWith("asic-"));
        assertEquals(1, sent.size());
        assertEquals(response.getProof().getNonce(), sent.get(0).getNonce());
        assertEquals(2, link.submits.get());
        assertEquals(2, link.cancelled.size());

        // 两个单元拿到互不重叠的区间
        assertEquals(0L, link.jobs.get("asic-0").getNonceStart());
        assertEquals(link.jobs.get("asic-0").getNonceEnd(), link.jobs.get("asic-1").getNonceStart());
        assertEquals(ProofHash.NONCE_LIMIT, link.jobs.get("asic-1").getNonceEnd());

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 单元在挑战中途故障：区间转交软件求解，挑战仍然完成
     */
    @Test
    public void testFaultMidChallengeFallsBackToSoftware() {
        log.info("=== Test: Fault Fallback ===");

        FakeDeviceLink link = new FakeDeviceLink();
        link.add("asic-0", Mode.FAULT);
        Challenge challenge = challenge(EASY_TARGET, 8_000L);

        MinerResponder responder = responder(link, null, Clock.systemUTC());
        MinerResponse response = responder.respond(challenge);

        assertTrue(response.isSolved());
        assertEquals(SoftwareSolver.DEVICE_ID, response.getProof().getDeviceId());
        assertValid(challenge, response.getProof());
        assertTrue(responder.getRegistry().isDegraded("asic-0"));

        log.info("=== Test PASSED ===\n");
    }

    @Test
    public void testInvalidShareIsRejected() {
        log.info("=== Test: Invalid Share ===");

        FakeDeviceLink link = new FakeDeviceLink();
        link.add("asic-0", Mode.BOGUS);
        Challenge challenge = challenge(EASY_TARGET, 8_000L);

        MinerResponder responder = responder(link, null, Clock.systemUTC());
        MinerResponse response = responder.respond(challenge);

        assertTrue(response.isSolved());
        assertEquals(SoftwareSolver.DEVICE_ID, response.getProof().getDeviceId());
        assertValid(challenge, response.getProof());
        assertTrue(responder.getRegistry().isDegraded("asic-0"));

        log.info("=== Test PASSED ===\n");
    }

    @Test
    public void testOverTemperatureDeviceIsDegraded() {
        log.info("=== Test: Over Temperature ===");

        FakeDeviceLink link = new FakeDeviceLink();
        link.add("asic-0", Mode.HOT);
        link.add("asic-1", Mode.PENDING);
        Challenge challenge = challenge(EASY_TARGET, 8_000L);

        MinerResponder responder = responder(link, null, Clock.systemUTC());
        MinerResponse response = responder.respond(challenge);

        assertTrue(response.isSolved());
        assertValid(challenge, response.getProof());
        assertTrue(responder.getRegistry().isDegraded("asic-0"));
        assertFalse(responder.getRegistry().isDegraded("asic-1"));

        log.info("=== Test PASSED ===\n");
    }

    @Test
    public void testSubmitFailureFallsBackToSoftware() {
        log.info("=== Test: Submit Failure ===");

        FakeDeviceLink link = new FakeDeviceLink();
        link.add("asic-0", Mode.REFUSE);
        Challenge challenge = challenge(EASY_TARGET, 8_000L);

        MinerResponder responder = responder(link, null, Clock.systemUTC());
        MinerResponse response = responder.respond(challenge);

        assertTrue(response.isSolved());
        assertEquals(SoftwareSolver.DEVICE_ID, response.getProof().getDeviceId());
        assertTrue(responder.getRegistry().isDegraded("asic-0"));

        log.info("=== Test PASSED ===\n");
    }

    @Test
    public void testNoDevicesUsesSoftware() {
        log.info("=== Test: Software Only ===");

        Challenge challenge = challenge(EASY_TARGET, 8_000L);
        MinerResponse response = responder(new FakeDeviceLink(), null, Clock.systemUTC()).respond(challenge);

        assertTrue(response.isSolved());
        assertEquals(SoftwareSolver.DEVICE_ID, response.getProof().getDeviceId());
        assertValid(challenge, response.getProof());

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 无解时在截止时间前返回"无解"，不提交
     */
    @Test
    public void testNoSolutionReturnsBeforeTimeout() {
        log.info("=== Test: Timely No Solution ===");

        FakeDeviceLink link = new FakeDeviceLink();
        link.add("asic-0", Mode.PENDING);
        List<Proof> sent = new CopyOnWriteArrayList<>();
        ProofSubmitter submitter = new ProofSubmitter(sent::add);
        Challenge challenge = challenge(IMPOSSIBLE_TARGET, 1_500L);

        long start = System.currentTimeMillis();
        MinerResponse response = responder(link, submitter, Clock.systemUTC()).respond(challenge);
        long took = System.currentTimeMillis() - start;
        submitter.close();

        assertFalse(response.isSolved());
        assertEquals(challenge.getId(), response.getChallengeId());
        assertTrue("Responder overran the challenge timeout: " + took + "ms", took < challenge.getTimeoutMillis());
        assertTrue(sent.isEmpty());
        assertEquals(1, link.cancelled.size());
        log.info("Response: {} in {}ms", response, took);

        log.info("=== Test PASSED ===\n");
    }

    @Test
    public void testNoSolutionWithSoftwareOnly() {
        log.info("=== Test: Software No Solution ===");

        Challenge challenge = challenge(IMPOSSIBLE_TARGET, 1_200L);
        long start = System.currentTimeMillis();
        MinerResponse response = responder(new FakeDeviceLink(), null, Clock.systemUTC()).respond(challenge);
        long took = System.currentTimeMillis() - start;

        assertFalse(response.isSolved());
        assertTrue("Responder overran the challenge timeout: " + took + "ms", took < challenge.getTimeoutMillis());

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 降级单元在 reprobeInterval 内不参与分配，到期探测健康后恢复
     */
    @Test
    public void testDegradedDeviceIsReprobed() {
        log.info("=== Test: Re-probe ===");

        FakeDeviceLink link = new FakeDeviceLink();
        link.add("asic-0", Mode.FAULT);
        MutableClock clock = new MutableClock(System.currentTimeMillis());
        MinerResponder responder = responder(link, null, clock);

        assertTrue(responder.respond(challenge(EASY_TARGET, 8_000L)).isSolved());
        assertEquals(1, link.submits.get());
        assertTrue(responder.getRegistry().isDegraded("asic-0"));

        link.modes.put("asic-0", Mode.SOLVE);
        assertTrue(responder.respond(challenge(EASY_TARGET, 8_000L)).isSolved());
        assertEquals("Degraded unit must be skipped", 1, link.submits.get());

        clock.advance(config.getReprobeIntervalMillis());
        MinerResponse response = responder.respond(challenge(EASY_TARGET, 8_000L));
        assertTrue(response.isSolved());
        assertEquals(2, link.submits.get());
        assertFalse(responder.getRegistry().isDegraded("asic-0"));
        assertEquals("asic-0", response.getProof().getDeviceId());

        log.info("=== Test PASSED ===\n");
    }

    @Test
    public void testMalformedChallengeMessage() {
        log.info("=== Test: Malformed Challenge ===");

        MinerResponse response = responder(new FakeDeviceLink(), null, Clock.systemUTC()).respond("garbage");
        assertFalse(response.isSolved());
        assertNull(response.getChallengeId());
        assertTrue(response.getReason().startsWith("malformed challenge"));

        log.info("=== Test PASSED ===\n");
    }

    private static String unsignedToken(String target, String payloadHex) {
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        String header = encoder.encodeToString("{\"alg\":\"HS256\"}".getBytes(StandardCharsets.UTF_8));
        String body = encoder.encodeToString(("{\"cid\":\"c-1\",\"cls\":\"standard\",\"tgt\":\"" + target
                + "\",\"tmo\":8000,\"pld\":\"" + payloadHex + "\",\"ims\":1}").getBytes(StandardCharsets.UTF_8));
        return header + "." + body + ".c2ln";
    }

    /**
     * payload 不是 32 字节十六进制时按格式错误丢弃，不抛出
     */
    @Test
    public void testNonHexPayloadIsMalformed() {
        log.info("=== Test: Non-hex Payload ===");

        MinerResponder responder = responder(new FakeDeviceLink(), null, Clock.systemUTC());
        String[] payloads = {"zz", "0g" + EASY_PAYLOAD.substring(2), EASY_PAYLOAD.substring(1)};
        for (String payloadHex : payloads) {
            MinerResponse response = responder.respond(unsignedToken("0fffffff", payloadHex));
            assertFalse(response.isSolved());
            assertNull(response.getChallengeId());
            assertTrue(response.getReason(), response.getReason().startsWith("malformed challenge"));
        }

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 超出 32 位的目标按格式错误丢弃，而不是空跑到截止时间
     */
    @Test
    public void testOversizedTargetIsMalformed() {
        log.info("=== Test: Oversized Target ===");

        MinerResponder responder = responder(new FakeDeviceLink(), null, Clock.systemUTC());
        long start = System.currentTimeMillis();
        MinerResponse response = responder.respond(unsignedToken("1ffffffff", EASY_PAYLOAD));
        long took = System.currentTimeMillis() - start;

        assertFalse(response.isSolved());
        assertTrue(response.getReason(), response.getReason().startsWith("malformed challenge"));
        assertTrue("Malformed target must be rejected up front: " + took + "ms", took < 1_000L);

        assertTrue(responder.respond(unsignedToken("0fffffff", EASY_PAYLOAD)).isSolved());

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 求解路径异常结束：立即返回带原因的无解，不等到截止时间
     */
    @Test
    public void testCrashedSolvingPathReportsFailure() {
        log.info("=== Test: Crashed Solving Path ===");

        FakeDeviceLink link = new FakeDeviceLink();
        link.add("asic-0", Mode.CRASH);
        Challenge challenge = challenge(IMPOSSIBLE_TARGET, 8_000L);

        long start = System.currentTimeMillis();
        MinerResponse response = responder(link, null, Clock.systemUTC()).respond(challenge);
        long took = System.currentTimeMillis() - start;

        assertFalse(response.isSolved());
        assertEquals(challenge.getId(), response.getChallengeId());
        assertTrue(response.getReason(), response.getReason().contains("driver crashed"));
        assertTrue("Failure must be reported before the deadline: " + took + "ms", took < 4_000L);
        assertEquals(1, link.cancelled.size());

        log.info("=== Test PASSED ===\n");
    }

    /**
     * 持有验证方密钥时，发给其他矿工的 Challenge 被拒绝
     */
    @Test
    public void testVerifiedTokenMustTargetThisMiner() {
        log.info("=== Test: Token Target Miner ===");

        ChallengeTokenCodec codec = new ChallengeTokenCodec(SECRET_KEY);
        Challenge challenge = challenge(EASY_TARGET, 8_000L);
        MinerResponder responder = new MinerResponder("miner-1", config, new FakeDeviceLink(), solver,
                null, codec, Clock.systemUTC());
        responders.add(responder);

        String foreign = codec.encode(challenge, Collections.singletonMap(ChallengeTokenCodec.CONTEXT_MINER, "miner-2"));
        assertFalse(responder.respond(foreign).isSolved());

        String own = codec.encode(challenge, Collections.singletonMap(ChallengeTokenCodec.CONTEXT_MINER, "miner-1"));
        MinerResponse response = responder.respond(own);
        assertTrue(response.isSolved());
        assertValid(challenge, response.getProof());

        log.info("=== Test PASSED ===\n");
    }

    private enum Mode {
        SOLVE, PENDING, FAULT, BOGUS, HOT, REFUSE, CRASH
    }

    /**
     * 脚本化的求解单元：按模式同步计算或模拟故障
     */
    private static class FakeDeviceLink implements DeviceLink {

        private final Map<String, Mode> modes = new ConcurrentHashMap<>();
        private final Map<String, DeviceJob> jobs = new ConcurrentHashMap<>();
        private final Map<String, Long> answers = new ConcurrentHashMap<>();
        private final List<String> cancelled = new CopyOnWriteArrayList<>();
        private final AtomicInteger submits = new AtomicInteger();

        void add(String deviceId, Mode mode) {
            modes.put(deviceId, mode);
        }

        @Override
        public List<String> devices() {
            return new ArrayList<>(modes.keySet());
        }

        @Override
        public DeviceTelemetry probe(String deviceId) {
            return telemetry(deviceId);
        }

        @Override
        public String submit(DeviceJob job) {
            Mode mode = modes.get(job.getDeviceId());
            if (mode == Mode.REFUSE) {
                throw new DeviceLinkException("connection refused");
            }
            submits.incrementAndGet();
            jobs.put(job.getDeviceId(), job);
            byte[] payload = ProofHash.hexToBytes(job.getPayloadHex());
            if (mode == Mode.SOLVE || mode == Mode.BOGUS) {
                boolean wantValid = mode == Mode.SOLVE;
                for (long nonce = job.getNonceStart(); nonce < job.getNonceEnd(); nonce++) {
                    if (ProofHash.verify(payload, nonce, job.getTarget()) == wantValid) {
                        answers.put(job.getDeviceId(), nonce);
                        break;
                    }
                }
            }
            return job.getDeviceId();
        }

        @Override
        public DevicePoll poll(String jobId) {
            Mode mode = modes.get(jobId);
            switch (mode) {
                case CRASH:
                    throw new IllegalStateException("driver crashed");
                case FAULT:
                    return DevicePoll.fault("hash board offline", telemetry(jobId));
                case SOLVE:
                case BOGUS:
                    return DevicePoll.found(answers.get(jobId), telemetry(jobId));
                default:
                    return DevicePoll.pending(telemetry(jobId));
            }
        }

        @Override
        public void cancel(String jobId) {
            cancelled.add(jobId);
        }

        private DeviceTelemetry telemetry(String deviceId) {
            return new DeviceTelemetry(modes.get(deviceId) == Mode.HOT ? 95.0 : 60.0, 1.0e9, 0L);
        }
    }
}
