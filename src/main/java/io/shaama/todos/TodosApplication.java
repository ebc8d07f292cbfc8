package io.shaama.todos;

import io.shaama.todos.config.EnvironmentDefaults;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class TodosApplication {

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(TodosApplication.class);
		application.setDefaultProperties(EnvironmentDefaults.fromEnvironment(System.getenv()));
		application.run(args);
	}

	// Timestamps are stored as UTC wall-clock values.
	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}
}
