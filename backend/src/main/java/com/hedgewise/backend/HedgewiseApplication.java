package com.hedgewise.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HedgewiseApplication {
	public static void main(String[] args) {
		SpringApplication.run(HedgewiseApplication.class, args);
	}
}
