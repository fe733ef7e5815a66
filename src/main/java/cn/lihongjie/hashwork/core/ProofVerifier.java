package cn.lihongjie.hashwork.core;

import cn.lihongjie.hashwork.model.Challenge;
import cn.lihongjie.hashwork.model.ChallengeState;
import cn.lihongjie.hashwork.model.Proof;
import cn.lihongjie.hashwork.model.VerificationOutcome;
import cn.lihongjie.hashwork.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Proof 校验器
 *
 * <p><b>核心算法</b>：
 * <pre>
 * 合法条件：SHA-256(payload || nonce_le32) ≤ expand(difficultyTarget)
 * </pre>
 *
 * <p><b>检查链</b>（按顺序，命中即返回）：
 * <ol>
 *   <li>Stale：Challenge 未知、不属于该矿工、已过期或已被非接受结论消费</li>
 *   <li>Duplicate：同一 (challengeId, minerId) 已有被接受的 Proof</li>
 *   <li>Late：submittedAt &gt; issuedAt + timeout + grace，与哈希是否合法无关</li>
 *   <li>哈希复算：合法则 Accepted，否则 Invalid</li>
 * </ol>
 *
 * <p>校验失败以 {@link VerificationOutcome} 返回，不抛异常。
 *
 * @author lihongjie
 */
public class ProofVerifier {

    private static final Logger log = LoggerFactory.getLogger(ProofVerifier.class);

    private final ChallengeLedger ledger;

    public ProofVerifier(ChallengeLedger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "Ledger cannot be null");
    }

    /**
     * 校验一次提交，并把 Challenge 迁移到对应终态
     *
     * @param minerId 提交方
     * @param proof 提交内容，submittedAt 为验证方接收时间
     */
    public VerificationResult verify(String minerId, Proof proof) {
        Objects.requireNonNull(minerId, "Miner id cannot be null");
        Objects.requireNonNull(proof, "Proof cannot be null");
        String challengeId = proof.getChallengeId();

        Optional<ChallengeLedger.Entry> found = ledger.find(challengeId);
        if (found.isEmpty() || !found.get().getMinerId().equals(minerId)) {
            log.warn("Proof rejected as stale, unknown challenge [challengeId={}, miner={}]", challengeId, minerId);
            return VerificationResult.unknown(challengeId, minerId, VerificationOutcome.STALE);
        }

        ChallengeLedger.Entry entry = found.get();
        Challenge challenge = entry.getChallenge();
        ChallengeState state = entry.getState();
        if (state == ChallengeState.ACCEPTED) {
            log.warn("Proof rejected as duplicate [challengeId={}, miner={}]", challengeId, minerId);
            return result(challenge, minerId, VerificationOutcome.DUPLICATE, -1L);
        }
        if (state.isTerminal()) {
            log.warn("Proof rejected as stale [challengeId={}, miner={}, state={}]", challengeId, minerId, state);
            return result(challenge, minerId, VerificationOutcome.STALE, -1L);
        }

        long deadline = challenge.acceptDeadline(ledger.getGracePeriodMillis());
        if (proof.getSubmittedAt() > deadline) {
            log.warn("Proof rejected as late [challengeId={}, miner={}, submittedAt={}, deadline={}]",
                    challengeId, minerId, proof.getSubmittedAt(), deadline);
            return settle(challenge, minerId, VerificationOutcome.LATE, -1L);
        }

        boolean valid = ProofHash.verify(
                ProofHash.hexToBytes(challenge.getPayloadHex()), proof.getNonce(), challenge.getDifficultyTarget());

        if (log.isDebugEnabled()) {
            log.debug("Proof verification detail:\n  Challenge: {}\n  Nonce: {}\n  Result: {}",
                    challenge, proof.getNonce(), valid ? "PASS" : "FAIL");
        }

        if (!valid) {
            log.warn("Proof verification FAILED [challengeId={}, miner={}, nonce={}, device={}]",
                    challengeId, minerId, proof.getNonce(), proof.getDeviceId());
            return settle(challenge, minerId, VerificationOutcome.INVALID, -1L);
        }

        long elapsed = proof.getSubmittedAt() - challenge.getIssuedAt();
        VerificationResult result = settle(challenge, minerId, VerificationOutcome.ACCEPTED, elapsed);
        if (result.isAccepted()) {
            log.info("Proof verification SUCCESS [challengeId={}, miner={}, nonce={}, elapsed={}ms]",
                    challengeId, minerId, proof.getNonce(), elapsed);
        }
        return result;
    }

    /**
     * 迁移到终态；若 Challenge 已被过期清扫抢先消费则按 Stale 处理
     */
    private VerificationResult settle(Challenge challenge, String minerId, VerificationOutcome outcome, long elapsed) {
        if (!ledger.complete(challenge.getId(), outcome.toState())) {
            log.warn("Challenge consumed concurrently, treating proof as stale [challengeId={}, miner={}]",
                    challenge.getId(), minerId);
            return result(challenge, minerId, VerificationOutcome.STALE, -1L);
        }
        return result(challenge, minerId, outcome, elapsed);
    }

    private static VerificationResult result(Challenge challenge, String minerId,
                                             VerificationOutcome outcome, long elapsed) {
        return new VerificationResult(challenge.getId(), minerId, outcome,
                challenge.getChallengeClass(), challenge.getDifficultyTarget(), elapsed);
    }
}
