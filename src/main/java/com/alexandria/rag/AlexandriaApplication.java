package com.alexandria.rag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.retry.annotation.EnableRetry;

import java.util.Arrays;

@EnableRetry
@SpringBootApplication
@ConfigurationPropertiesScan
public class AlexandriaApplication {

	static final String CLI_FLAG = "--app.cli.enabled=true";

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(AlexandriaApplication.class);
		// one-shot commands do not need the web server
		if (Arrays.asList(args).contains(CLI_FLAG)) {
			application.setWebApplicationType(WebApplicationType.NONE);
		}

		ConfigurableApplicationContext context = application.run(args);
		if (context.getEnvironment().getProperty("app.cli.enabled", Boolean.class, false)) {
			System.exit(SpringApplication.exit(context));
		}
	}
}
