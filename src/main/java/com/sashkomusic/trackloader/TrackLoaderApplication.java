package com.sashkomusic.trackloader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrackLoaderApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(TrackLoaderApplication.class, args)));
	}

}
