package com.di.starnova;

import com.di.starnova.config.StarNovaProperties;
import com.di.starnova.exception.ErrorCategory;
import com.di.starnova.runner.StarSchemaPipelineRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(StarNovaProperties.class)
public class StarNovaApplication {

	public static void main(String[] args) {
		System.exit(run(args));
	}

	/**
	 * Starts the context and, unless disabled, runs the pipeline once.
	 *
	 * @return process exit code: 0 after a published run, 1 on any fatal error
	 */
	static int run(String... args) {
		ConfigurableApplicationContext ctx;
		try {
			ctx = SpringApplication.run(StarNovaApplication.class, args);
		} catch (RuntimeException e) {
			log.error("Application failed to start: {}", e.getMessage(), e);
			return 1;
		}
		int exitCode = 0;
		try {
			if (ctx.getBean(StarNovaProperties.class).isRunOnStartup()) {
				ctx.getBean(StarSchemaPipelineRunner.class).run();
			}
		} catch (RuntimeException e) {
			ErrorCategory category = ErrorCategory.categorize(e);
			log.error("Pipeline failed [{}]: {}", category.getName(), e.getMessage());
			exitCode = 1;
		}
		int code = exitCode;
		return SpringApplication.exit(ctx, () -> code);
	}
}
