package com.minimember.gateway.notify;

public interface MembershipUpdateSink {

    void notify(MembershipUpdate update);
}
