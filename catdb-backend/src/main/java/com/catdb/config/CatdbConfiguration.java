package com.catdb.config;

import com.catdb.util.DeadlineRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@Slf4j
@Configuration
public class CatdbConfiguration {

    @Bean
    public CatdbSettings catdbSettings(Environment environment) {
        CatdbSettings settings = CatdbSettings.fromEnvironment(environment);
        log.info(
                "catdb settings resolved (config_dir={}, statement_timeout_ms={}, default_row_limit={}, probe_timeout_ms={})",
                settings.configDir(),
                settings.statementTimeout().toMillis(),
                settings.defaultRowLimit(),
                settings.probeTimeout().toMillis()
        );
        return settings;
    }

    @Bean(destroyMethod = "close")
    public DeadlineRunner deadlineRunner() {
        return new DeadlineRunner("catdb-bounded");
    }
}
