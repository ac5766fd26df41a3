package com.accessgate.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AccessGateApplication {

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC so token expiry and cleanup schedules agree
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(AccessGateApplication.class, args);
	}

}
