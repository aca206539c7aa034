package com.caltrade.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CalendarTradeApplication {
	public static void main(String[] args) {
		SpringApplication.run(CalendarTradeApplication.class, args);
	}
}
