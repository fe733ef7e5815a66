package cn.lihongjie.hashwork.core;

import cn.lihongjie.hashwork.model.ChallengeClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 挑战类别加权抽样表（累积分布，配置变化时整体重建）
 *
 * @author lihongjie
 */
final class WeightedClassTable {

    private final ChallengeClass[] classes;
    private final double[] cumulative;

    WeightedClassTable(Map<ChallengeClass, Double> weights) {
        List<ChallengeClass> entries = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        double sum = 0.0;
        for (Map.Entry<ChallengeClass, Double> entry : weights.entrySet()) {
            if (entry.getValue() > 0.0) {
                entries.add(entry.getKey());
                values.add(entry.getValue());
                sum += entry.getValue();
            }
        }
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("No challenge class has positive weight");
        }
        this.classes = entries.toArray(new ChallengeClass[0]);
        this.cumulative = new double[classes.length];
        double running = 0.0;
        for (int i = 0; i < classes.length; i++) {
            running += values.get(i) / sum;
            cumulative[i] = running;
        }
        cumulative[classes.length - 1] = 1.0;
    }

    ChallengeClass draw(Random random) {
        double u = random.nextDouble();
        for (int i = 0; i < cumulative.length; i++) {
            if (u < cumulative[i]) {
                return classes[i];
            }
        }
        return classes[classes.length - 1];
    }

    /**
     * 某类别的抽中概率
     */
    double probability(ChallengeClass challengeClass) {
        double previous = 0.0;
        for (int i = 0; i < classes.length; i++) {
            if (classes[i] == challengeClass) {
                return cumulative[i] - previous;
            }
            previous = cumulative[i];
        }
        return 0.0;
    }
}
