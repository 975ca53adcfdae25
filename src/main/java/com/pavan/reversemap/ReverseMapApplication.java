package com.pavan.reversemap;

import com.pavan.reversemap.demo.ExampleWalkthrough;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

@SpringBootApplication
public class ReverseMapApplication implements CommandLineRunner {

	private static final Logger logger = LoggerFactory.getLogger(ReverseMapApplication.class);

	@Value("${reversemap.demo.enabled:true}")
	private boolean demoEnabled;

	private ExampleWalkthrough walkthrough;

	public static void main(String[] args) {
		SpringApplication.run(ReverseMapApplication.class, args);
	}

	@Override
	public void run(String... args) {
		printBanner();
		if (!demoEnabled) {
			logger.info("Example walkthrough disabled (reversemap.demo.enabled=false)");
			return;
		}

		logger.info("Running example walkthrough...");
		try {
			List<String> lines = exampleWalkthrough().run();
			logger.info("Example walkthrough finished ({} lines)", lines.size());
		} catch (RuntimeException e) {
			logger.error("Example walkthrough failed: {}", e.getMessage());
			throw e;
		}
	}

	private void printBanner() {
		logger.info("=".repeat(60));
		logger.info("  ReverseIterableMap");
		logger.info("");
		logger.info("  Insertion-ordered map with forward and reverse iteration");
		logger.info("=".repeat(60));
	}

	@Bean
	public ExampleWalkthrough exampleWalkthrough() {
		if (walkthrough == null) {
			walkthrough = new ExampleWalkthrough();
		}
		return walkthrough;
	}
}
