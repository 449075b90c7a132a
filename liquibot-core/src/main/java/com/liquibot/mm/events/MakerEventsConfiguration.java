package com.liquibot.mm.events;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods=false)
@EnableConfigurationProperties(MakerEventsProperties.class)
public class MakerEventsConfiguration {

  @Bean
  @ConditionalOnProperty(prefix="maker.events", name="enabled", havingValue="true")
  public MakerEventPublisher springMakerEventPublisher(ApplicationEventPublisher publisher, ObjectProvider<Clock> clock) {
    return new SpringMakerEventPublisher(publisher, clock.getIfAvailable(Clock::systemUTC));
  }

  @Bean
  @ConditionalOnMissingBean(MakerEventPublisher.class)
  public MakerEventPublisher noopMakerEventPublisher() {
    return new NoopMakerEventPublisher();
  }
}
