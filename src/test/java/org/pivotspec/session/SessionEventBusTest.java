package org.pivotspec.session;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pivotspec.pivot.PivotAssignments;
import org.pivotspec.query.FilterExposure;

@Tag("unit")
@DisplayName("SessionEventBus")
class SessionEventBusTest {

    @Test
    @DisplayName("Typed subscriptions only see their event type")
    void typedSubscription() {
        SessionEventBus bus = new SessionEventBus();
        List<SessionEvent.FiltersRemoved> removed = new ArrayList<>();
        List<SessionEvent> all = new ArrayList<>();
        bus.subscribe(SessionEvent.FiltersRemoved.class, removed::add);
        bus.subscribeAll(all::add);

        bus.publish(new SessionEvent.WorkingCopyChanged(PivotAssignments.empty()));
        bus.publish(new SessionEvent.FiltersRemoved(List.of("region"), FilterExposure.none()));

        assertThat(removed).hasSize(1);
        assertThat(all).hasSize(2);
    }

    @Test
    @DisplayName("Closing a subscription stops delivery")
    void unsubscribe() {
        SessionEventBus bus = new SessionEventBus();
        List<SessionEvent> received = new ArrayList<>();
        SessionEventBus.Subscription subscription = bus.subscribeAll(received::add);

        subscription.close();
        bus.publish(new SessionEvent.WorkingCopyChanged(PivotAssignments.empty()));

        assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("A failing listener does not starve the others")
    void failingListener() {
        SessionEventBus bus = new SessionEventBus();
        List<SessionEvent> received = new ArrayList<>();
        bus.subscribeAll(event -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribeAll(received::add);

        bus.publish(new SessionEvent.WorkingCopyChanged(PivotAssignments.empty()));

        assertThat(received).hasSize(1);
    }
}
