package com.minimember.config;

import com.minimember.gateway.identity.IdentityResolver;
import com.minimember.gateway.identity.InMemoryIdentityDirectory;
import com.minimember.gateway.notify.MembershipUpdateSink;
import com.minimember.gateway.notify.SpringEventUpdateSink;
import com.minimember.gateway.remote.RemoteTransport;
import com.minimember.gateway.remote.UnconfiguredRemoteTransport;
import com.minimember.gateway.store.KeyValueStore;
import com.minimember.gateway.store.RedisKeyValueStore;
import com.minimember.gateway.timer.SchedulerTimerService;
import com.minimember.gateway.timer.TimerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * 成员子系统的装配。
 *
 * <p>外部协作者（远端、身份、通知、持久化）都只在容器里没有同类型 bean 时才注册默认实现，
 * 宿主应用声明自己的 bean 即可替换。</p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
        MembershipProperties.class,
        MembershipCacheProperties.class,
        OnlineMemberCountProperties.class,
        MembershipPlanProperties.class
})
public class MembershipConfig {

    /**
     * 唯一的工作线程：所有状态修改、远端回调续接、定时器都在这里执行。
     */
    @Bean("membershipWorker")
    public ThreadPoolTaskScheduler membershipWorker() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("membership-worker-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> log.error("membership worker task failed", t));
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock membershipClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TimerService membershipTimerService(@Qualifier("membershipWorker") ThreadPoolTaskScheduler membershipWorker, Clock clock) {
        return new SchedulerTimerService(membershipWorker, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RemoteTransport remoteTransport() {
        return new UnconfiguredRemoteTransport();
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore membershipKeyValueStore(MembershipCacheProperties props, StringRedisTemplate redis) {
        return new RedisKeyValueStore(props, redis);
    }

    @Bean
    @ConditionalOnMissingBean(IdentityResolver.class)
    public InMemoryIdentityDirectory identityDirectory() {
        return new InMemoryIdentityDirectory();
    }

    @Bean
    @ConditionalOnMissingBean
    public MembershipUpdateSink membershipUpdateSink(ApplicationEventPublisher publisher) {
        return new SpringEventUpdateSink(publisher);
    }
}
