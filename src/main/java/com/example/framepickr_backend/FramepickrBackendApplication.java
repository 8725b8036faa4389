package com.example.framepickr_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FramepickrBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(FramepickrBackendApplication.class, args);
	}

}
