package cn.lihongjie.hashwork.model;

/**
 * 单次挑战得分
 *
 * <p>final = clamp(base + Σbonus, 0, capTotal)
 *
 * @author lihongjie
 */
public class Score {

    private final String challengeId;
    private final String minerId;
    private final VerificationOutcome outcome;
    private final double base;
    private final BonusBreakdown bonus;
    private final double finalScore;

    public Score(String challengeId, String minerId, VerificationOutcome outcome,
                 double base, BonusBreakdown bonus, double finalScore) {
        this.challengeId = challengeId;
        this.minerId = minerId;
        this.outcome = outcome;
        this.base = base;
        this.bonus = bonus;
        this.finalScore = finalScore;
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

    public double getBase() {
        return base;
    }

    public BonusBreakdown getBonus() {
        return bonus;
    }

    public double getFinal() {
        return finalScore;
    }

    @Override
    public String toString() {
        return "Score{" +
                "challengeId='" + challengeId + '\'' +
                ", minerId='" + minerId + '\'' +
                ", outcome=" + outcome +
                ", base=" + base +
                ", " + bonus +
                String.format(", final=%.4f", finalScore) +
                '}';
    }
}
