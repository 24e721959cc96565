package com.codifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Codifier - applies amendment instructions to the text of an Act under human review.
 */
@SpringBootApplication
public class CodifierApplication {

	public static void main(String[] args) {
		SpringApplication.run(CodifierApplication.class, args);
	}

}
