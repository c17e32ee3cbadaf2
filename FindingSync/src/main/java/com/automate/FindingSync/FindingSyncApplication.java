package com.automate.FindingSync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FindingSyncApplication {
	public static void main(String[] args) {
		SpringApplication.run(FindingSyncApplication.class, args);
	}

}
