package cn.lihongjie.hashwork.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 按矿工串行的任务队列
 *
 * <p>同一 minerId 的任务按提交顺序逐个执行（前一个结束后才开始下一个），
 * 不同矿工的任务在共享线程池上并发执行。
 *
 * @author lihongjie
 */
public class MinerTaskQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MinerTaskQueue.class);

    private final ExecutorService executor;
    private final Map<String, CompletableFuture<?>> tails = new ConcurrentHashMap<>();

    public MinerTaskQueue(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be >= 1");
        }
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "miner-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newFixedThreadPool(threads, factory);
    }

    /**
     * 把任务排到该矿工队列末尾
     */
    public <T> CompletableFuture<T> submit(String minerId, Supplier<T> task) {
        @SuppressWarnings("unchecked")
        CompletableFuture<T>[] holder = new CompletableFuture[1];
        tails.compute(minerId, (id, tail) -> {
            CompletableFuture<?> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            CompletableFuture<T> next = previous
                    .handle((ignored, error) -> null)
                    .thenApplyAsync(ignored -> task.get(), executor);
            holder[0] = next;
            return next;
        });
        return holder[0];
    }

    /**
     * 等待当前已排队的全部任务结束（任务失败不影响等待）
     */
    public void drain() {
        CompletableFuture<?>[] pending = tails.values().toArray(new CompletableFuture[0]);
        CompletableFuture.allOf(pending).handle((ignored, error) -> null).join();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Miner task queue did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
