package com.statsdb.statsdb_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StatsdbApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(StatsdbApiApplication.class, args);
	}

}
