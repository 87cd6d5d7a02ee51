package dev.gaugeinjector.gi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GaugeInjectorApplication {

  public static void main(String[] args) {
    SpringApplication.run(GaugeInjectorApplication.class, args);
  }

}
