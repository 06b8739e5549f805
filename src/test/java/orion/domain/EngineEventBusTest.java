package orion.domain;

import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Tests for EngineEventBus
 *
 * @author Orion team
 * @since 19/10/2026
 */
class EngineEventBusTest {

    @Test
    @DisplayName("A failing subscriber should not stop delivery or reach the poster")
    void failingSubscriberShouldBeIsolated() {
        // Given
        EngineEventBus bus = new EngineEventBus();
        List<String> received = new ArrayList<>();
        bus.register(new Object() {
            @Subscribe
            public void onEvent(String event) {
                throw new IllegalStateException("boom");
            }
        });
        bus.register(new Object() {
            @Subscribe
            public void onEvent(String event) {
                received.add(event);
            }
        });

        // When / Then
        assertThatCode(() -> bus.post("channel-changed")).doesNotThrowAnyException();
        assertThat(received).containsExactly("channel-changed");
    }

    @Test
    @DisplayName("Unregistered subscribers should receive nothing")
    void unregisteredSubscriberShouldReceiveNothing() {
        // Given
        EngineEventBus bus = new EngineEventBus();
        List<Integer> received = new ArrayList<>();
        Object subscriber = new Object() {
            @Subscribe
            public void onEvent(Integer event) {
                received.add(event);
            }
        };
        bus.register(subscriber);
        bus.post(1);

        // When
        bus.unregister(subscriber);
        bus.post(2);

        // Then
        assertThat(received).containsExactly(1);
    }
}
