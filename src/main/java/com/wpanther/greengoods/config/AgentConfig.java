package com.wpanther.greengoods.config;

import com.wpanther.greengoods.port.AiPort;
import com.wpanther.greengoods.port.LedgerPort;
import com.wpanther.greengoods.port.Notifier;
import com.wpanther.greengoods.service.LoggingNotifier;
import com.wpanther.greengoods.service.RegexWorkTextParser;
import com.wpanther.greengoods.service.UnconfiguredLedgerPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Shared infrastructure beans and the default collaborators used when no adapter supplies its own.
 */
@Configuration
@Slf4j
public class AgentConfig {

    /**
     * Provides a SecureRandom bean for key material, salts and ids
     *
     * @return a new SecureRandom instance
     */
    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(AiPort.class)
    public AiPort aiPort(Clock clock) {
        log.info("No AI port configured, using regex work-text parser");
        return new RegexWorkTextParser(clock);
    }

    @Bean
    @ConditionalOnMissingBean(Notifier.class)
    public Notifier notifier() {
        log.info("No notifier configured, notifications will only be logged");
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnMissingBean(LedgerPort.class)
    public LedgerPort ledgerPort() {
        log.warn("No ledger client configured: role checks fail closed and attestations are refused");
        return new UnconfiguredLedgerPort();
    }
}
