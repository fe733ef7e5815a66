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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * HashWork 进程内 Demo
 *
 * <p>演示完整流程：
 * <ol>
 *   <li>验证方按矿工签发 Challenge</li>
 *   <li>矿工用模拟硬件求解（其中一台矿机的单元中途故障，转软件兜底）</li>
 *   <li>验证方校验、评分</li>
 *   <li>epoch 结束时导出共识权重</li>
 * </ol>
 *
 * @author lihongjie
 */
public class HashWorkDemo {

    private static final Logger log = LoggerFactory.getLogger(HashWorkDemo.class);

    private static final String SECRET_KEY = "ThisIsAVerySecureSecretKeyWith256Bits!!";

    private static final int DEFAULT_ROUNDS = 3;

    public static void main(String[] args) {
        int rounds = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_ROUNDS;

        System.out.println("╔══════════════════════════════════════════════════════════╗");
        System.out.println("║        HashWork Challenge-Response Mining Demo           ║");
        System.out.println("║                  Author: lihongjie                       ║");
        System.out.println("╚══════════════════════════════════════════════════════════╝");
        System.out.println();

        ValidatorConfig validatorConfig = ValidatorConfig.load(ValidatorConfig.DEFAULT_RESOURCE);
        MinerConfig minerConfig = MinerConfig.load(MinerConfig.DEFAULT_RESOURCE);
        ChallengeTokenCodec tokenCodec = new ChallengeTokenCodec(SECRET_KEY);
        ProofMessageCodec proofCodec = new ProofMessageCodec();

        String[] minerIds = {"miner-alpha", "miner-beta", "miner-gamma"};
        List<SimulatedDeviceLink> links = new ArrayList<>();
        List<ProofSubmitter> submitters = new ArrayList<>();
        List<MinerResponder> responders = new ArrayList<>();

        try (ValidatorService validator = new ValidatorService(validatorConfig, SECRET_KEY, null);
             SoftwareSolver solver = new SoftwareSolver(minerConfig, Clock.systemUTC())) {

            for (int i = 0; i < minerIds.length; i++) {
                String minerId = minerIds[i];
                SimulatedDeviceLink link = new SimulatedDeviceLink(2 - Math.min(i, 2));
                ProofSubmitter submitter = new ProofSubmitter(proof ->
                        validator.submit(minerId, proofCodec.encode(proof))
                                .thenAccept(score -> printScore(score))
                                .join());
                links.add(link);
                submitters.add(submitter);
                responders.add(new MinerResponder(minerId, minerConfig, link, solver, submitter,
                        tokenCodec, Clock.systemUTC()));
            }

            for (int round = 1; round <= rounds; round++) {
                System.out.println("\n" + "=".repeat(60));
                System.out.println("Round " + round + "/" + rounds);
                System.out.println("=".repeat(60));

                if (round == 2 && !links.get(0).devices().isEmpty()) {
                    String device = links.get(0).devices().get(0);
                    links.get(0).injectFault(device);
                    System.out.println("  ⚠ Injected fault into " + minerIds[0] + "/" + device);
                }

                for (MinerResponder responder : responders) {
                    String token = validator.issue(responder.getMinerId());
                    long start = System.nanoTime();
                    MinerResponse response = responder.respond(token);
                    long micros = (System.nanoTime() - start) / 1_000;
                    if (response.isSolved()) {
                        System.out.println("  ✓ " + responder.getMinerId() + " solved "
                                + response.getChallengeId().substring(0, 12) + "... via "
                                + response.getProof().getDeviceId() + " in " + micros / 1000 + "ms");
                    } else {
                        System.out.println("  ✗ " + responder.getMinerId() + " no solution: " + response.getReason());
                    }
                }
            }

            for (ProofSubmitter submitter : submitters) {
                submitter.close();
            }
            validator.expireOverdue();
            EpochWeights weights = validator.closeEpoch();

            System.out.println("\n" + "-".repeat(60));
            System.out.println("📊 Epoch " + weights.getEpoch() + " weights");
            System.out.println("-".repeat(60));
            for (Map.Entry<String, Double> entry : weights.getWeights().entrySet()) {
                MinerSnapshot snapshot = validator.snapshot(entry.getKey()).orElse(null);
                System.out.printf("  • %-12s weight=%.4f  accepted=%s  early-bonus=%s%n",
                        entry.getKey(), entry.getValue(),
                        snapshot != null ? snapshot.getAcceptedCount() + "/" + snapshot.getChallengeCount() : "-",
                        weights.getEarlyBonusMiners().contains(entry.getKey()) ? "yes" : "no");
            }
            System.out.printf("  Σ = %.4f%n", weights.total());
        } finally {
            for (MinerResponder responder : responders) {
                responder.close();
            }
            for (SimulatedDeviceLink link : links) {
                link.close();
            }
        }
        log.info("Demo finished [rounds={}]", rounds);
    }

    private static void printScore(Score score) {
        System.out.printf("    → %s %s final=%.3f (%s)%n",
                score.getMinerId(), score.getOutcome(), score.getFinal(), score.getBonus());
    }
}
