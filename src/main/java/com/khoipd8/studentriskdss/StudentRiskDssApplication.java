package com.khoipd8.studentriskdss;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StudentRiskDssApplication {

	public static void main(String[] args) {
		SpringApplication.run(StudentRiskDssApplication.class, args);
	}

}
