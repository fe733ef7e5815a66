package cn.lihongjie.hashwork.model;

/**
 * 一次校验的结论
 *
 * <p>{@code elapsedMs} 仅对 ACCEPTED 有意义：submittedAt - issuedAt。
 *
 * @author lihongjie
 */
public class VerificationResult {

    private final String challengeId;
    private final String minerId;
    private final VerificationOutcome outcome;
    private final ChallengeClass challengeClass;
    private final long difficultyTarget;
    private final long elapsedMs;

    public VerificationResult(String challengeId, String minerId, VerificationOutcome outcome,
                              ChallengeClass challengeClass, long difficultyTarget, long elapsedMs) {
        this.challengeId = challengeId;
        this.minerId = minerId;
        this.outcome = outcome;
        this.challengeClass = challengeClass;
        this.difficultyTarget = difficultyTarget;
        this.elapsedMs = elapsedMs;
    }

    /**
     * 针对未知 Challenge 的结论（类别与目标未知）
     */
    public static VerificationResult unknown(String challengeId, String minerId, VerificationOutcome outcome) {
        return new VerificationResult(challengeId, minerId, outcome, null, 0L, -1L);
    }

    public static VerificationResult expired(Challenge challenge, String minerId) {
        return new VerificationResult(challenge.getId(), minerId, VerificationOutcome.EXPIRED,
                challenge.getChallengeClass(), challenge.getDifficultyTarget(), -1L);
    }

    public String getChallengeId() {
        return challengeId;
    }

    public String getMinerId() {
        return minerId;
    }

    public VerificationOutcome getOutcome() {
        return outcome;
    }

    /**
     * @return Challenge 类别，STALE 时为 null
     */
    public ChallengeClass getChallengeClass() {
        return challengeClass;
    }

    public long getDifficultyTarget() {
        return difficultyTarget;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public boolean isAccepted() {
        return outcome.isAccepted();
    }

    @Override
    public String toString() {
        return "VerificationResult{" +
                "challengeId='" + challengeId + '\'' +
                ", minerId='" + minerId + '\'' +
                ", outcome=" + outcome +
                ", elapsed=" + elapsedMs + "ms" +
                '}';
    }
}
