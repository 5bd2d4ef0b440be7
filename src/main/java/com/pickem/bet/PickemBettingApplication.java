package com.pickem.bet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PickemBettingApplication {

	public static void main(String[] args) {
		SpringApplication.run(PickemBettingApplication.class, args);
	}
}
