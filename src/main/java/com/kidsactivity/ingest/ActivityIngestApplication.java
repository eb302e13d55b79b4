package com.kidsactivity.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ActivityIngestApplication {

	public static void main(String[] args) {
		SpringApplication.run(ActivityIngestApplication.class, args);
	}

}
