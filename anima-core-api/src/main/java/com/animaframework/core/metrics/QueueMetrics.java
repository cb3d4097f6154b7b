package com.animaframework.core.metrics;

import java.util.function.IntSupplier;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import lombok.Getter;

/**
 * 命令队列性能指标
 * 用于监控工作线程的执行情况和订阅丢弃情况
 */
@Getter
public class QueueMetrics {

    private final String queueName;
    private final MetricRegistry metricsRegistry;

    /**
     * 命令统计
     */
    private final Meter commands;
    private final Meter queries;
    private final Counter commandFailures;
    private final Counter cancelledCommands;
    private final Timer commandExecutionTimer;

    /**
     * 订阅统计
     */
    private final Counter droppedPropertyUpdates;
    private final Counter publishedPropertyUpdates;

    /**
     * 批量绘制统计
     */
    private final Meter drawBatches;
    private final Counter skippedDrawCommands;

    public QueueMetrics(String queueName) {
        this.queueName = queueName;
        this.metricsRegistry = new MetricRegistry();

        commands = metricsRegistry.meter(MetricRegistry.name("anima", queueName, "commands", "total"));
        queries = metricsRegistry.meter(MetricRegistry.name("anima", queueName, "commands", "queries"));
        commandFailures = metricsRegistry.counter(MetricRegistry.name("anima", queueName, "errors", "commands"));
        cancelledCommands = metricsRegistry.counter(MetricRegistry.name("anima", queueName, "commands", "cancelled"));
        commandExecutionTimer = metricsRegistry.timer(
                MetricRegistry.name("anima", queueName, "performance", "commandExecutionTime"));

        droppedPropertyUpdates = metricsRegistry.counter(
                MetricRegistry.name("anima", queueName, "properties", "dropped"));
        publishedPropertyUpdates = metricsRegistry.counter(
                MetricRegistry.name("anima", queueName, "properties", "published"));

        drawBatches = metricsRegistry.meter(MetricRegistry.name("anima", queueName, "render", "batches"));
        skippedDrawCommands = metricsRegistry.counter(
                MetricRegistry.name("anima", queueName, "render", "skipped"));
    }

    /**
     * 注册动态指标，例如待完成查询数和存活句柄数
     */
    public void registerGauge(String name, IntSupplier supplier) {
        metricsRegistry.gauge(MetricRegistry.name("anima", queueName, "gauges", name),
                () -> (Gauge<Integer>) supplier::getAsInt);
    }

    public void recordDroppedPropertyUpdates(long count) {
        droppedPropertyUpdates.inc(count);
    }
}
