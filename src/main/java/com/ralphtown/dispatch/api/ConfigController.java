package com.ralphtown.dispatch.api;

import com.ralphtown.core.persistence.RecordNotFoundException;
import com.ralphtown.core.persistence.SessionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Key/value settings persisted in the store.
 */
@RestController
@RequestMapping("/api/config")
public class ConfigController {

    private final SessionStore store;

    public ConfigController(SessionStore store) {
        this.store = store;
    }

    @GetMapping
    public Map<String, String> listConfig() {
        return store.listConfig();
    }

    @GetMapping("/{key}")
    public Map<String, String> getConfig(@PathVariable String key) {
        String value = store.getConfig(key).orElseThrow(() -> new RecordNotFoundException("Config key", key));
        return Map.of("key", key, "value", value);
    }

    @PutMapping("/{key}")
    public ResponseEntity<Map<String, String>> setConfig(@PathVariable String key,
                                                         @RequestBody ConfigValueRequest request) {
        if (request.value() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "value is required"));
        }
        store.setConfig(key, request.value());
        return ResponseEntity.ok(Map.of("key", key, "value", request.value()));
    }
}
