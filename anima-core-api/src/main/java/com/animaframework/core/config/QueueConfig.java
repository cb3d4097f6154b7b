package com.animaframework.core.config;

import com.animaframework.core.property.OverflowPolicy;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 命令队列配置，对应 anima-queue.json。
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueueConfig {

    /**
     * 队列名称，用于工作线程名和日志
     */
    @JsonProperty("name")
    private String name = "default";

    /**
     * 工作线程每个循环最多执行的命令数
     */
    @JsonProperty("command_batch_size")
    private int commandBatchSize = 64;

    @JsonProperty("idle_max_spins")
    private long idleMaxSpins = 1;

    @JsonProperty("idle_max_yields")
    private long idleMaxYields = 1;

    @JsonProperty("idle_min_park_ns")
    private long idleMinParkNs = 50;

    @JsonProperty("idle_max_park_ns")
    private long idleMaxParkNs = 100_000;

    /**
     * 每个订阅者的缓冲区容量
     */
    @JsonProperty("subscriber_buffer_capacity")
    private int subscriberBufferCapacity = 32;

    /**
     * 订阅者缓冲区满时的处理策略
     */
    @JsonProperty("overflow_policy")
    private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;

    /**
     * 销毁时等待工作线程退出的最长时间
     */
    @JsonProperty("shutdown_timeout_ms")
    private long shutdownTimeoutMs = 3_000;

    public static QueueConfig defaults() {
        return new QueueConfig();
    }

    /**
     * 校验配置取值，非法时抛出 IllegalArgumentException
     */
    public QueueConfig validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (commandBatchSize < 1) {
            throw new IllegalArgumentException("command_batch_size must be >= 1, was " + commandBatchSize);
        }
        if (subscriberBufferCapacity < 1) {
            throw new IllegalArgumentException(
                    "subscriber_buffer_capacity must be >= 1, was " + subscriberBufferCapacity);
        }
        if (idleMinParkNs < 1 || idleMaxParkNs < idleMinParkNs) {
            throw new IllegalArgumentException("invalid idle park range: " + idleMinParkNs + ".." + idleMaxParkNs);
        }
        if (overflowPolicy == null) {
            throw new IllegalArgumentException("overflow_policy must not be null");
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException("shutdown_timeout_ms must be >= 0");
        }
        return this;
    }
}
