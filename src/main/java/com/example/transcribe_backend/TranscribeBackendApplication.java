package com.example.transcribe_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class TranscribeBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(TranscribeBackendApplication.class, args);
	}

}
