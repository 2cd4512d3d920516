package com.draftreview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * DraftReview - revision critique and suggestion application service.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class DraftReviewApplication {

	public static void main(String[] args) {
		SpringApplication.run(DraftReviewApplication.class, args);
	}

}
