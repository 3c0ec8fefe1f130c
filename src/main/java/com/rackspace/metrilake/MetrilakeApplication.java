package com.rackspace.metrilake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import reactor.core.scheduler.Schedulers;

@SpringBootApplication
public class MetrilakeApplication {

	public static void main(String[] args) {
		Schedulers.enableMetrics();
		SpringApplication.run(MetrilakeApplication.class, args);
	}

}
