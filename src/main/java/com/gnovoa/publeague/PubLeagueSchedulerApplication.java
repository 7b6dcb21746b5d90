// Namespace
package com.gnovoa.publeague;

// Imports
import com.gnovoa.publeague.rosters.SchedulerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties(SchedulerProperties.class)
public class PubLeagueSchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(PubLeagueSchedulerApplication.class, args);
  }
}
