package com.example.chunker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point of the statement chunker.
 * Only wires the application context; the HTTP endpoints live under the interfaces layer.
 */
@SpringBootApplication
public class ChunkerApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(ChunkerApplication.class, args);
	}

}
