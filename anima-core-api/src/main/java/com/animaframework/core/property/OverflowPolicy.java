package com.animaframework.core.property;

/**
 * 订阅者缓冲区满时的处理策略。发布方（工作线程）在任何策略下都不会阻塞。
 */
public enum OverflowPolicy {

    /**
     * 丢弃最旧的一条，保留最新的更新
     */
    DROP_OLDEST,

    /**
     * 丢弃新到的更新，保留缓冲区中已有的
     */
    DROP_LATEST
}
