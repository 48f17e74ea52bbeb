package com.example.brd;

import com.example.brd.config.BrdProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BrdProperties.class)
public class BrdClassifierApplication {

	public static void main(String[] args) {
		SpringApplication.run(BrdClassifierApplication.class, args);
	}

}
