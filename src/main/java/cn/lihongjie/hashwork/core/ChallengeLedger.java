package cn.lihongjie.hashwork.core;

import cn.lihongjie.hashwork.model.Challenge;
import cn.lihongjie.hashwork.model.ChallengeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 已签发 Challenge 台账，驱动单个 Challenge 的状态机
 *
 * <pre>
 * ISSUED → AWAITING_PROOF → {ACCEPTED | REJECTED_*}    收到提交
 * ISSUED → AWAITING_PROOF → EXPIRED                   截止 + 宽限期内无有效提交
 * </pre>
 *
 * <p>终态不可再迁移；超过截止时间的条目在清扫时移出台账。线程安全。
 *
 * @author lihongjie
 */
public class ChallengeLedger {

    private static final Logger log = LoggerFactory.getLogger(ChallengeLedger.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final long gracePeriodMillis;

    public ChallengeLedger(long gracePeriodMillis) {
        if (gracePeriodMillis < 0) {
            throw new IllegalArgumentException("Grace period must be >= 0");
        }
        this.gracePeriodMillis = gracePeriodMillis;
    }

    /**
     * 登记新签发的 Challenge（状态 ISSUED）
     *
     * @throws IllegalStateException ID 已存在
     */
    public void register(Challenge challenge, String minerId) {
        Objects.requireNonNull(challenge, "Challenge cannot be null");
        Objects.requireNonNull(minerId, "Miner id cannot be null");
        Entry previous = entries.putIfAbsent(challenge.getId(), new Entry(challenge, minerId));
        if (previous != null) {
            throw new IllegalStateException("Challenge id already issued: " + challenge.getId());
        }
    }

    /**
     * 已下发给矿工，开始等待提交
     */
    public void markAwaiting(String challengeId) {
        Entry entry = entries.get(challengeId);
        if (entry != null) {
            entry.transition(ChallengeState.ISSUED, ChallengeState.AWAITING_PROOF);
        }
    }

    public Optional<Entry> find(String challengeId) {
        return Optional.ofNullable(entries.get(challengeId));
    }

    /**
     * 把未决 Challenge 迁移到终态
     *
     * @return false 表示该 Challenge 已被其他路径（如过期清扫）消费
     */
    public boolean complete(String challengeId, ChallengeState terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminal);
        }
        Entry entry = entries.get(challengeId);
        return entry != null && entry.finish(terminal);
    }

    /**
     * 清扫过期条目：未决的迁移到 EXPIRED 并返回，所有超过截止时间的条目移出台账
     */
    public List<Entry> sweepExpired(long now) {
        List<Entry> expired = new ArrayList<>();
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            Entry entry = it.next();
            if (now <= entry.getChallenge().acceptDeadline(gracePeriodMillis)) {
                continue;
            }
            if (entry.finish(ChallengeState.EXPIRED)) {
                expired.add(entry);
                log.warn("Challenge expired [id={}, miner={}]", entry.getChallenge().getId(), entry.getMinerId());
            }
            it.remove();
        }
        return expired;
    }

    public ChallengeState stateOf(String challengeId) {
        Entry entry = entries.get(challengeId);
        return entry == null ? null : entry.getState();
    }

    public long getGracePeriodMillis() {
        return gracePeriodMillis;
    }

    public int size() {
        return entries.size();
    }

    /**
     * 台账条目：Challenge、被签发的矿工、当前状态
     */
    public static final class Entry {

        private final Challenge challenge;
        private final String minerId;
        private ChallengeState state = ChallengeState.ISSUED;

        private Entry(Challenge challenge, String minerId) {
            this.challenge = challenge;
            this.minerId = minerId;
        }

        public Challenge getChallenge() {
            return challenge;
        }

        public String getMinerId() {
            return minerId;
        }

        public synchronized ChallengeState getState() {
            return state;
        }

        private synchronized void transition(ChallengeState from, ChallengeState to) {
            if (state == from) {
                state = to;
            }
        }

        private synchronized boolean finish(ChallengeState terminal) {
            if (state.isTerminal()) {
                return false;
            }
            state = terminal;
            return true;
        }
    }
}
