package com.heronix.scheduler.config;

import java.util.Random;

import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Random source for the distributors.
 *
 * Prototype scoped: every distribution run asks for a fresh instance. When
 * {@code heronix.scheduler.distribution.seed} is set each instance starts from
 * that seed, so a run over the same data can be replayed exactly.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class DistributionRandomConfig {

    private final SchedulerProperties properties;

    @Bean
    @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
    public Random distributionRandom() {
        SchedulerProperties.DistributionConfig config = properties.getDistribution();
        if (!config.isDeterministic()) {
            log.debug("Distribution run uses an unseeded random source");
            return new Random();
        }
        log.debug("Distribution run uses seed {}", config.getSeed());
        return new Random(config.getSeed());
    }
}
