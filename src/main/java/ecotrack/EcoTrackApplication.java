package ecotrack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EcoTrackApplication {
  public static void main(String[] args) {
    SpringApplication.run(EcoTrackApplication.class, args);
  }
}
