package com.quick.guessing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GuessingApplication {

	public static void main(String[] args) {
		SpringApplication.run(GuessingApplication.class, args);
	}

}
