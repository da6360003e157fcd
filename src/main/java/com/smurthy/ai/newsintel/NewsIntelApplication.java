package com.smurthy.ai.newsintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NewsIntelApplication {

	public static void main(String[] args) {
		SpringApplication.run(NewsIntelApplication.class, args);
	}

}
