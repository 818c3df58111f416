package com.driveflow.crm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DriveFlowApplication {

	public static void main(String[] args) {
		SpringApplication.run(DriveFlowApplication.class, args);
	}
}
