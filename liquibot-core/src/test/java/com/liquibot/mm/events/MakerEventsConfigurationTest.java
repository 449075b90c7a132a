package com.liquibot.mm.events;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MakerEventsConfigurationTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(MakerEventsConfiguration.class, ListenerConfig.class);

  @Test
  void noopPublisherByDefault() {
    runner.run(context -> {
      MakerEventPublisher publisher = context.getBean(MakerEventPublisher.class);
      assertThat(publisher).isInstanceOf(NoopMakerEventPublisher.class);
      assertThat(publisher.isEnabled()).isFalse();

      publisher.publish(MakerEventTypes.ORDER_PLACED, "o-1", "payload");
      assertThat(context.getBean(EventSink.class).events).isEmpty();
      assertThat(context.getBean(MakerEventsProperties.class).retained()).isEqualTo(500);
    });
  }

  @Test
  void enabledPublisherDeliversToListenersWithClockTimestamp() {
    runner.withPropertyValues("maker.events.enabled=true", "maker.events.retained=10").run(context -> {
      MakerEventPublisher publisher = context.getBean(MakerEventPublisher.class);
      assertThat(publisher).isInstanceOf(SpringMakerEventPublisher.class);
      assertThat(publisher.isEnabled()).isTrue();

      publisher.publish(MakerEventTypes.ORDER_PLACED, "o-1", "payload");
      publisher.publish(Instant.EPOCH, MakerEventTypes.ORDER_CANCELED, "o-1", null);

      List<MakerEvent> events = context.getBean(EventSink.class).events;
      assertThat(events).extracting(MakerEvent::type)
          .containsExactly(MakerEventTypes.ORDER_PLACED, MakerEventTypes.ORDER_CANCELED);
      assertThat(events.get(0).ts()).isEqualTo(NOW);
      assertThat(events.get(0).data()).isEqualTo("payload");
      assertThat(events.get(1).ts()).isEqualTo(Instant.EPOCH);
      assertThat(context.getBean(MakerEventsProperties.class).retained()).isEqualTo(10);
    });
  }

  @Test
  void failingListenerDoesNotReachPublisher() {
    runner.withPropertyValues("maker.events.enabled=true").run(context -> {
      context.getBean(EventSink.class).fail = true;

      context.getBean(MakerEventPublisher.class).publish(MakerEventTypes.RUN_STARTED, "r1", null);

      assertThat(context.getBean(EventSink.class).events).hasSize(1);
    });
  }

  @Configuration(proxyBeanMethods=false)
  static class ListenerConfig {

    @Bean
    Clock clock() {
      return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Bean
    EventSink eventSink() {
      return new EventSink();
    }
  }

  static class EventSink {

    final List<MakerEvent> events = new ArrayList<>();
    volatile boolean fail;

    @EventListener
    public void on(MakerEvent event) {
      events.add(event);
      if (fail) {
        throw new IllegalStateException("listener down");
      }
    }
  }
}
