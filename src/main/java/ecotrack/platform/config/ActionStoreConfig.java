package ecotrack.platform.config;

import ecotrack.core.actions.ActionRecordsPort;
import ecotrack.core.actions.ActionStore;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ActionStoreConfig {
  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public ActionStore actionStore(ActionRecordsPort actionRecordsPort, Clock clock) {
    return new ActionStore(actionRecordsPort, clock);
  }
}
