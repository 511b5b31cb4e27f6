package ecotrack.platform.delivery.web;

import ecotrack.core.actions.Action;
import ecotrack.core.actions.ActionFields;
import ecotrack.core.actions.ActionStore;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/actions")
public class ActionsApiController {
  private static final String ITEM = "/{id:\\d+}";
  private static final String ITEM_SLASH = "/{id:\\d+}/";

  private final ActionStore actionStore;

  public ActionsApiController(ActionStore actionStore) {
    this.actionStore = actionStore;
  }

  @GetMapping(path = {"", "/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<Action>> list() {
    return ResponseEntity.ok(actionStore.list());
  }

  @PostMapping(
      path = {"", "/"},
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Action> create(@RequestBody Map<String, Object> body) {
    Action created = actionStore.create(ActionFields.fromMap(body));
    return ResponseEntity.status(HttpStatus.CREATED).body(created);
  }

  @GetMapping(path = {ITEM, ITEM_SLASH}, produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Action> get(@PathVariable("id") long id) {
    return ResponseEntity.ok(actionStore.get(id));
  }

  @PutMapping(
      path = {ITEM, ITEM_SLASH},
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Action> replace(
      @PathVariable("id") long id, @RequestBody Map<String, Object> body) {
    return ResponseEntity.ok(actionStore.update(id, ActionFields.fromMap(body), false));
  }

  @PatchMapping(
      path = {ITEM, ITEM_SLASH},
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Action> patch(
      @PathVariable("id") long id, @RequestBody Map<String, Object> body) {
    return ResponseEntity.ok(actionStore.update(id, ActionFields.fromMap(body), true));
  }

  @DeleteMapping(path = {ITEM, ITEM_SLASH})
  public ResponseEntity<Void> delete(@PathVariable("id") long id) {
    actionStore.delete(id);
    return ResponseEntity.noContent().build();
  }
}
