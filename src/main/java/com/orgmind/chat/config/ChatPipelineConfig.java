package com.orgmind.chat.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * 流式管线的基础设施 bean。
 */
@Configuration
public class ChatPipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 生成工作线程池：每次生成独占一个 worker，与请求线程及其他生成隔离。
     * 线程与排队任务都满时拒绝新任务，编排器据此返回 503。
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler generationScheduler(
            @Value("${app.chat.generation.scheduler.thread-cap:64}") int threadCap,
            @Value("${app.chat.generation.scheduler.queue-cap:256}") int queueCap) {
        return Schedulers.newBoundedElastic(threadCap, queueCap, "chat-generation");
    }
}
