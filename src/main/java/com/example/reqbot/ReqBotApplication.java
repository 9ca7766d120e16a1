package com.example.reqbot;

import com.example.reqbot.config.ExtractionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ExtractionProperties.class)
public class ReqBotApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReqBotApplication.class, args);
	}

}
