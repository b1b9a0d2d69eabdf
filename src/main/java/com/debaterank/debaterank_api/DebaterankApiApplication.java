package com.debaterank.debaterank_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DebaterankApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(DebaterankApiApplication.class, args);
	}

}
