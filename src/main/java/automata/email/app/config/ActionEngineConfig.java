package automata.email.app.config;

import automata.email.app.engine.BatchActionEngine;
import automata.email.app.engine.EntityKind;
import automata.email.app.mailbox.MessageHandle;
import automata.email.app.mailbox.ThreadHandle;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One engine per granularity. Both share the same aggregation and dispatch
 * code and differ only in the entity kind they accept.
 */
@Configuration
@EnableConfigurationProperties(MailActionProperties.class)
public class ActionEngineConfig {

    @Bean
    public BatchActionEngine<ThreadHandle> threadActionEngine() {
        return new BatchActionEngine<>(EntityKind.THREAD);
    }

    @Bean
    public BatchActionEngine<MessageHandle> messageActionEngine() {
        return new BatchActionEngine<>(EntityKind.MESSAGE);
    }
}
