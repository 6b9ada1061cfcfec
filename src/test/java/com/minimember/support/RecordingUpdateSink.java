package com.minimember.support;

import com.minimember.gateway.notify.MembershipUpdate;
import com.minimember.gateway.notify.MembershipUpdateSink;

import java.util.ArrayList;
import java.util.List;

public class RecordingUpdateSink implements MembershipUpdateSink {

    private final List<MembershipUpdate> updates = new ArrayList<>();

    @Override
    public void notify(MembershipUpdate update) {
        updates.add(update);
    }

    public List<MembershipUpdate> all() {
        return List.copyOf(updates);
    }

    public <U extends MembershipUpdate> List<U> of(Class<U> type) {
        List<U> out = new ArrayList<>();
        for (MembershipUpdate u : updates) {
            if (type.isInstance(u)) {
                out.add(type.cast(u));
            }
        }
        return out;
    }

    public void clear() {
        updates.clear();
    }
}
