package cn.lihongjie.hashwork.store;

import cn.lihongjie.hashwork.exception.HashWorkException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * 检查点文件存储（JSON）
 *
 * <p>先写同目录临时文件再原子替换，进程中途崩溃不会留下半个检查点。
 *
 * @author lihongjie
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final Path file;
    private final ObjectMapper mapper;

    public CheckpointStore(Path file) {
        this.file = Objects.requireNonNull(file, "Checkpoint file cannot be null");
        this.mapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void save(Checkpoint checkpoint) {
        Objects.requireNonNull(checkpoint, "Checkpoint cannot be null");
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), checkpoint);
                try {
                    Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new HashWorkException("Failed to write checkpoint: " + file, e);
        }
        log.info("Checkpoint saved [file={}, miners={}, epoch={}]",
                file, checkpoint.getMiners().size(), checkpoint.getEpoch());
    }

    /**
     * @return 不存在检查点时为空
     * @throws HashWorkException 文件存在但无法解析
     */
    public Optional<Checkpoint> load() {
        if (!Files.exists(file)) {
            log.info("No checkpoint found [file={}]", file);
            return Optional.empty();
        }
        try {
            Checkpoint checkpoint = mapper.readValue(file.toFile(), Checkpoint.class);
            log.info("Checkpoint loaded [file={}, miners={}, epoch={}]",
                    file, checkpoint.getMiners().size(), checkpoint.getEpoch());
            return Optional.of(checkpoint);
        } catch (IOException e) {
            throw new HashWorkException("Failed to read checkpoint: " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
