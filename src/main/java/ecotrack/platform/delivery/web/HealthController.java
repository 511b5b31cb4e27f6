package ecotrack.platform.delivery.web;

import ecotrack.core.actions.ActionStore;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
  private final ActionStore actionStore;

  public HealthController(ActionStore actionStore) {
    this.actionStore = actionStore;
  }

  // Reads the backing file, so a broken store surfaces as 500 here too.
  @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> body = Map.of("status", "ok", "actions", actionStore.list().size());
    return ResponseEntity.ok(body);
  }
}
