package com.classmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the classroom monitor relay
 *
 * Relays camera frames to live viewers and pushes alerts to every device of a
 * recipient, using:
 * - Spring WebFlux on Netty for non-blocking WebSockets
 * - Reactor for per-connection and per-camera pipelines
 * - R2DBC for classroom lookup and alert records
 */
@SpringBootApplication
@EnableScheduling
public class ClassMonitorApplication {

	public static void main(String[] args) {
		SpringApplication.run(ClassMonitorApplication.class, args);
	}
}
