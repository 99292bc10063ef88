package com.ephemera.store;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class EphemeraStoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(EphemeraStoreApplication.class, args);
	}

}
