package cn.lihongjie.hashwork.core;

import cn.lihongjie.hashwork.config.ValidatorConfig;
import cn.lihongjie.hashwork.model.Challenge;
import cn.lihongjie.hashwork.model.ChallengeClass;
import cn.lihongjie.hashwork.model.MinerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Challenge 生成器
 *
 * <p><b>流程</b>：
 * <ol>
 *   <li>按配置的类别权重加权抽取挑战类别</li>
 *   <li>取类别基准参数（目标、时限），交由 DifficultyController 做矿工级覆盖</li>
 *   <li>生成一次性随机 payload（防预计算重放）</li>
 *   <li>id = SHA-256(payload || target || issuedAt) 前 32 个十六进制字符</li>
 * </ol>
 *
 * @author lihongjie
 */
public class ChallengeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ChallengeGenerator.class);

    private static final int ID_HEX_CHARS = 32;

    private final Clock clock;
    private final SecureRandom payloadRandom;
    private final Random classRandom;
    private volatile WeightedClassTable classTable;

    /**
     * @param config 验证方配置（类别权重）
     * @param clock 签发时间来源
     * @param classRandom 类别抽样随机源（与 payload 随机源分离，便于复现抽样序列）
     */
    public ChallengeGenerator(ValidatorConfig config, Clock clock, Random classRandom) {
        Objects.requireNonNull(config, "Config cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.classRandom = Objects.requireNonNull(classRandom, "Random cannot be null");
        this.payloadRandom = new SecureRandom();
        this.classTable = new WeightedClassTable(config.getClassWeights());
    }

    public ChallengeGenerator(ValidatorConfig config) {
        this(config, Clock.systemUTC(), new SecureRandom());
    }

    /**
     * 类别权重变化时整体重建抽样表
     */
    public void updateClassWeights(Map<ChallengeClass, Double> weights) {
        this.classTable = new WeightedClassTable(weights);
        log.info("Rebuilt challenge class table [weights={}]", weights);
    }

    public ChallengeClass drawClass() {
        return classTable.draw(classRandom);
    }

    /**
     * 当前抽样表中某类别的抽中概率
     */
    public double classProbability(ChallengeClass challengeClass) {
        return classTable.probability(challengeClass);
    }

    /**
     * 为指定矿工生成 Challenge：抽类别后由 DifficultyController 覆盖目标
     */
    public Challenge generate(MinerRecord record, DifficultyController difficultyController) {
        ChallengeClass challengeClass = drawClass();
        long target = difficultyController.effectiveTarget(record, challengeClass);
        Challenge challenge = generate(challengeClass, target);
        log.info("Generated challenge [id={}, miner={}, class={}, target=0x{}]",
                challenge.getId(), record.getMinerId(), challengeClass.getCode(),
                String.format("%08x", target));
        return challenge;
    }

    /**
     * 以类别基准目标生成 Challenge
     */
    public Challenge generate(ChallengeClass challengeClass) {
        return generate(challengeClass, challengeClass.getBaseTarget());
    }

    public Challenge generate(ChallengeClass challengeClass, long difficultyTarget) {
        Objects.requireNonNull(challengeClass, "Challenge class cannot be null");
        if (difficultyTarget <= 0 || difficultyTarget > 0xffffffffL) {
            throw new IllegalArgumentException("Difficulty target must be in (0, 0xffffffff]");
        }

        byte[] payload = new byte[Challenge.PAYLOAD_BYTES];
        payloadRandom.nextBytes(payload);
        long issuedAt = clock.millis();

        Challenge challenge = Challenge.builder()
                .id(deriveId(payload, difficultyTarget, issuedAt))
                .challengeClass(challengeClass)
                .difficultyTarget(difficultyTarget)
                .timeoutMillis(challengeClass.getTimeoutMillis())
                .issuedAt(issuedAt)
                .payloadHex(ProofHash.bytesToHex(payload))
                .build();

        log.debug("Challenge detail: {}", challenge);
        return challenge;
    }

    /**
     * 确定性派生 Challenge ID，相同 (payload, target, issuedAt) 总是得到相同 ID
     */
    public static String deriveId(byte[] payload, long difficultyTarget, long issuedAt) {
        MessageDigest digest = ProofHash.newDigest();
        digest.update(payload);
        digest.update(ByteBuffer.allocate(Long.BYTES * 2)
                .putLong(difficultyTarget)
                .putLong(issuedAt)
                .array());
        return ProofHash.bytesToHex(digest.digest()).substring(0, ID_HEX_CHARS);
    }
}
