package cn.lihongjie.hashwork.client;

import cn.lihongjie.hashwork.model.Proof;

/**
 * 矿工对一个 Challenge 的最终响应：已复验的 Proof，或"无解"
 *
 * @author lihongjie
 */
public class MinerResponse {

    private final String challengeId;
    private final Proof proof;
    private final String reason;

    private MinerResponse(String challengeId, Proof proof, String reason) {
        this.challengeId = challengeId;
        this.proof = proof;
        this.reason = reason;
    }

    public static MinerResponse solved(Proof proof) {
        return new MinerResponse(proof.getChallengeId(), proof, null);
    }

    public static MinerResponse noSolution(String challengeId, String reason) {
        return new MinerResponse(challengeId, null, reason);
    }

    /**
     * @return Challenge ID；消息无法解析时为 null
     */
    public String getChallengeId() {
        return challengeId;
    }

    public boolean isSolved() {
        return proof != null;
    }

    public Proof getProof() {
        return proof;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isSolved()
                ? "MinerResponse{solved, " + proof + '}'
                : "MinerResponse{no solution, challengeId='" + challengeId + "', reason='" + reason + "'}";
    }
}
