package com.di.starnova.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level properties (application.yml, prefix {@code starnova.pipeline}).
 * The pipeline itself is configured by the document at {@link #configFile}.
 */
@Data
@ConfigurationProperties(prefix = "starnova.pipeline")
public class StarNovaProperties {

    /** Location of the pipeline configuration document, e.g. file:./config.yaml. */
    private String configFile = "classpath:pipeline_config.yml";

    /** When false the application starts without running the pipeline. */
    private boolean runOnStartup = true;
}
