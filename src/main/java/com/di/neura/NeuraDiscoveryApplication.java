package com.di.neura;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NeuraDiscoveryApplication {

	public static void main(String[] args) {
		SpringApplication.run(NeuraDiscoveryApplication.class, args);
	}
}
