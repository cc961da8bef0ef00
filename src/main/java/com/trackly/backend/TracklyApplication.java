package com.trackly.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TracklyApplication {

	public static void main(String[] args) {
		SpringApplication.run(TracklyApplication.class, args);
	}

}
