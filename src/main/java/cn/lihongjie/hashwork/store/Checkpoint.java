package cn.lihongjie.hashwork.store;

import cn.lihongjie.hashwork.model.MinerSnapshot;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 验证方状态检查点：全部矿工快照 + epoch 计数
 *
 * @author lihongjie
 */
public class Checkpoint {

    private final long savedAt;
    private final long epoch;
    private final List<MinerSnapshot> miners;

    @JsonCreator
    public Checkpoint(@JsonProperty("savedAt") long savedAt,
                      @JsonProperty("epoch") long epoch,
                      @JsonProperty("miners") List<MinerSnapshot> miners) {
        this.savedAt = savedAt;
        this.epoch = epoch;
        this.miners = miners == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(miners));
    }

    public long getSavedAt() {
        return savedAt;
    }

    public long getEpoch() {
        return epoch;
    }

    public List<MinerSnapshot> getMiners() {
        return miners;
    }

    @Override
    public String toString() {
        return "Checkpoint{" +
                "savedAt=" + savedAt +
                ", epoch=" + epoch +
                ", miners=" + miners.size() +
                '}';
    }
}
