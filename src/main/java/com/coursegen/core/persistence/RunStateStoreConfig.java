package com.coursegen.core.persistence;

import com.coursegen.core.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

import javax.sql.DataSource;

/**
 * Provides the {@link RunStateStore} bean.
 * <p>
 * Under the {@code postgres} profile, which also enables the {@link DataSource}, run state is kept
 * in PostgreSQL. Otherwise it is written as JSON into the artifact store next to the run's content.
 */
@Configuration
public class RunStateStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(RunStateStoreConfig.class);

    @Bean
    @Primary
    @Profile("postgres")
    public RunStateStore jdbcRunStateStore(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC run state store (PostgreSQL)");
        var store = new JdbcRunStateStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(RunStateStore.class)
    public RunStateStore artifactRunStateStore(ArtifactStore artifactStore) {
        log.info("Keeping run state in the artifact store");
        return new ArtifactRunStateStore(artifactStore);
    }
}
