package com.eatsential.eatsential_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EatsentialApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(EatsentialApiApplication.class, args);
	}

}
