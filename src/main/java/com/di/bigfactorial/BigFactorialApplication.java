package com.di.bigfactorial;

import com.di.bigfactorial.cli.FactorialCommand;
import com.di.bigfactorial.config.ReductionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties(ReductionProperties.class)
public class BigFactorialApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(BigFactorialApplication.class, args);
		int exitCode = ctx.getBean(FactorialCommand.class).execute(args, System.out);
		System.exit(SpringApplication.exit(ctx, () -> exitCode));
	}
}
