package cn.lihongjie.hashwork.model;

/**
 * 单个 Challenge 的生命周期状态
 *
 * <pre>
 * ISSUED → AWAITING_PROOF → ACCEPTED | REJECTED_INVALID | REJECTED_LATE
 *                         → EXPIRED（截止 + 宽限期内无被接受的 Proof）
 * </pre>
 *
 * <p>REJECTED_STALE / REJECTED_DUPLICATE 描述的是针对未知或已终结 Challenge 的提交，
 * 不会改变原 Challenge 的状态。所有非 ISSUED / AWAITING_PROOF 状态均为终态，不会重试。
 *
 * @author lihongjie
 */
public enum ChallengeState {
    ISSUED,
    AWAITING_PROOF,
    ACCEPTED,
    REJECTED_INVALID,
    REJECTED_LATE,
    REJECTED_STALE,
    REJECTED_DUPLICATE,
    EXPIRED;

    public boolean isTerminal() {
        return this != ISSUED && this != AWAITING_PROOF;
    }
}
