package com.example.resq_ai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResqAiApplication {

	public static void main(String[] args) {
		SpringApplication.run(ResqAiApplication.class, args);
	}

}
