package com.example.rebus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point of the rebus benchmark evaluator.
 * Only wires the application context; extraction and scoring live in the domain and application layers.
 */
@SpringBootApplication
public class RebusBenchApplication {

	/**
	 * Boots the Spring container and exposes the HTTP endpoints defined under the interfaces layer.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(RebusBenchApplication.class, args);
	}

}
