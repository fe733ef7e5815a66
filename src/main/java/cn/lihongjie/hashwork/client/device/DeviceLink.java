package cn.lihongjie.hashwork.client.device;

import cn.lihongjie.hashwork.exception.DeviceLinkException;

import java.util.List;

/**
 * 硬件求解单元 RPC 接口（需外部实现）
 *
 * <p>所有方法在通信失败时抛出 {@link DeviceLinkException}，调用方按硬件故障处理。
 *
 * @author lihongjie
 */
public interface DeviceLink extends AutoCloseable {

    /**
     * 已连接的求解单元 ID
     */
    List<String> devices();

    /**
     * 健康探测：读取单元遥测
     */
    DeviceTelemetry probe(String deviceId);

    /**
     * 下发任务
     *
     * @return job_id
     */
    String submit(DeviceJob job);

    DevicePoll poll(String jobId);

    void cancel(String jobId);

    @Override
    default void close() {
    }
}
