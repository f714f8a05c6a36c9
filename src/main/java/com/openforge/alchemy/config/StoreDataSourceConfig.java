package com.openforge.alchemy.config;

import com.openforge.alchemy.store.StoreProperties;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Pooled connections to the single SQLite store file.
 *
 * The SQLite driver will not create missing parent directories, so they are
 * created here before the pool (and Hibernate behind it) opens the file.
 * The JDBC URL itself comes from spring.datasource.url; pool tuning from
 * spring.datasource.hikari.*.
 */
@Slf4j
@Configuration
public class StoreDataSourceConfig {

    @Bean
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource dataSource(DataSourceProperties dataSourceProperties,
                                       StoreProperties storeProperties) throws IOException {
        Path file = Paths.get(storeProperties.path()).toAbsolutePath();
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        log.info("[Store] Opening store file {}", file);
        return dataSourceProperties.initializeDataSourceBuilder()
                .type(HikariDataSource.class)
                .build();
    }
}
