package com.minimember.gateway.notify;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

/**
 * 把更新作为 Spring 应用事件发布，界面层用 {@code @EventListener} 订阅。
 */
@Slf4j
@RequiredArgsConstructor
public class SpringEventUpdateSink implements MembershipUpdateSink {

    private final ApplicationEventPublisher publisher;

    @Override
    public void notify(MembershipUpdate update) {
        if (update == null) {
            return;
        }
        log.debug("membership update: {}", update);
        publisher.publishEvent(update);
    }
}
