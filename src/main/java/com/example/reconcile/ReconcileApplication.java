package com.example.reconcile;

import com.example.reconcile.config.ReviewProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ReviewProperties.class)
public class ReconcileApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReconcileApplication.class, args);
	}

}
