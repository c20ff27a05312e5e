package com.pwn.writeups;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WriteupCrawlerApplication {

  public static void main(String[] args) {
    SpringApplication.run(WriteupCrawlerApplication.class, args);
  }
}
