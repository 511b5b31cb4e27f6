package ecotrack.platform.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import ecotrack.platform.adapters.actions.JsonFileActionRecordsAdapter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;

@Configuration
@Profile("!test")
public class ActionRecordsAdapterConfig {
  static final String ACTIONS_PATH_PROPERTY = "ecotrack.actions.path";
  static final String DEFAULT_ACTIONS_PATH = "data/actions_data.json";

  @Bean(initMethod = "open", destroyMethod = "close")
  public JsonFileActionRecordsAdapter jsonFileActionRecordsAdapter(
      ObjectMapper objectMapper,
      Environment environment) {
    String actionsPath = environment.getProperty(ACTIONS_PATH_PROPERTY, DEFAULT_ACTIONS_PATH);
    return new JsonFileActionRecordsAdapter(objectMapper, actionsPath);
  }
}
