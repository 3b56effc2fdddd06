package com.querytuner.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's {@code @ConfigurationProperties} classes.
 *
 * <ul>
 *   <li>{@link ClickHouseConfig} - analytical engine connection and retry
 *   <li>{@link ExplainProperties} - diagnostics defaults and branch naming
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    ClickHouseConfig.class,
    ExplainProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
