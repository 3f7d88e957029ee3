package io.polylog.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.polylog.core.OrderingKeyGenerator;
import io.polylog.store.AttributeStore;
import io.polylog.store.InMemoryAttributeStore;
import io.polylog.store.TypedSequences;
import io.polylog.store.pg.PostgresAttributeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
@EnableConfigurationProperties(PolylogProperties.class)
public class Beans {
    private static final Logger log = LoggerFactory.getLogger(Beans.class);

    @Bean
    @Profile("inmem")
    AttributeStore inMemoryStore() {
        return new InMemoryAttributeStore();
    }

    @Bean
    @Profile("pg")
    AttributeStore postgresStore(JdbcTemplate jdbc, PlatformTransactionManager transactionManager,
                                 ObjectMapper mapper, PolylogProperties props) {
        var transactionTemplate = new TransactionTemplate(transactionManager);
        transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        return new PostgresAttributeStore(jdbc, transactionTemplate, mapper, props.store().pageSize());
    }

    @Bean
    OrderingKeyGenerator orderingKeyGenerator(PolylogProperties props) {
        var seed = props.keys().seed();
        if (seed == null) return OrderingKeyGenerator.system();
        log.warn("Using deterministic ordering keys (seed {})", seed);
        return OrderingKeyGenerator.deterministic(seed);
    }

    @Bean
    TypedSequences typedSequences(AttributeStore store, ObjectMapper mapper, OrderingKeyGenerator keys) {
        return new TypedSequences(store, mapper, keys);
    }
}
