package cn.lihongjie.hashwork.model;

/**
 * Proof 校验结果
 *
 * <p>除 ACCEPTED 外都按失败挑战计入矿工滚动统计，从不静默丢弃。
 *
 * @author lihongjie
 */
public enum VerificationOutcome {
    ACCEPTED(ChallengeState.ACCEPTED),
    INVALID(ChallengeState.REJECTED_INVALID),
    LATE(ChallengeState.REJECTED_LATE),
    STALE(ChallengeState.REJECTED_STALE),
    DUPLICATE(ChallengeState.REJECTED_DUPLICATE),
    EXPIRED(ChallengeState.EXPIRED);

    private final ChallengeState state;

    VerificationOutcome(ChallengeState state) {
        this.state = state;
    }

    public ChallengeState toState() {
        return state;
    }

    public boolean isAccepted() {
        return this == ACCEPTED;
    }

    /**
     * 矿工确实提交了答案（用于接受率 accepted / submitted）
     */
    public boolean isSubmission() {
        return this != EXPIRED;
    }
}
