package dev.secondbrain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the Second Brain retrieval core.
 *
 * <p>Runs without a web server; the search facade is consumed in-process.
 */
@SpringBootApplication
@EnableScheduling
public class SecondBrainApplication {
  public static void main(String[] args) {
    SpringApplication.run(SecondBrainApplication.class, args);
  }
}
