package com.skindx;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SkinDx - multi-stage skin image diagnosis service.
 */
@SpringBootApplication
@EnableScheduling
public class SkinDxApplication {

	public static void main(String[] args) {
		SpringApplication.run(SkinDxApplication.class, args);
	}

}
