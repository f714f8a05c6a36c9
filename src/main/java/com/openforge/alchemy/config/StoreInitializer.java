package com.openforge.alchemy.config;

import com.openforge.alchemy.settings.StoreConfigService;
import com.openforge.alchemy.store.SchemaManager;
import com.openforge.alchemy.store.StoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * Brings the store file to the current schema and seeds missing policy keys
 * while the context starts, before any request can reach a repository.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreInitializer implements InitializingBean {

    private final SchemaManager      schemaManager;
    private final StoreConfigService configService;
    private final StoreProperties    properties;

    @Override
    public void afterPropertiesSet() {
        SchemaManager.SchemaStatus status = schemaManager.ensureSchema();
        configService.seedDefaults(properties.lifecycle());
        log.info("[Schema] Store ready at schema v{}", status.currentVersion());
    }
}
