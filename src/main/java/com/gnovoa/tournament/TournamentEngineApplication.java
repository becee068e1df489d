// Namespace
package com.gnovoa.tournament;

// Imports
import com.gnovoa.tournament.config.SimProperties;
import com.gnovoa.tournament.config.TournamentProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties({TournamentProperties.class, SimProperties.class})
public class TournamentEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(TournamentEngineApplication.class, args);
  }
}
