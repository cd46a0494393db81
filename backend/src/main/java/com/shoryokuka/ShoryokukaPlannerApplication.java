package com.shoryokuka;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Shoryokuka Planner - business plan section generation for labour-saving subsidy applications.
 */
@SpringBootApplication
public class ShoryokukaPlannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShoryokukaPlannerApplication.class, args);
	}

}
