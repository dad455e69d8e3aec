package com.example.storyboard_matcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StoryboardMatcherApplication {

	public static void main(String[] args) {
		SpringApplication.run(StoryboardMatcherApplication.class, args);
	}

}
