package com.tony.cardLeague;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CardLeagueApplication {

	public static void main(String[] args) {
		SpringApplication.run(CardLeagueApplication.class, args);
	}

}
