/*
 * Where: Datastore application entry point
 * What: Boots Spring and scans configuration properties
 * Why: Enables the engine, scheduled retention and the read API together
 */
package com.configwatch.datastore;

import com.configwatch.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class DatastoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(DatastoreApplication.class, args);
  }
}
