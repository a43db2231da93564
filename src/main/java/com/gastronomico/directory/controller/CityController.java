package com.gastronomico.directory.controller;

import com.gastronomico.directory.events.ChangeNotifier;
import com.gastronomico.directory.events.EventTypes;
import com.gastronomico.directory.model.CityRequest;
import com.gastronomico.directory.model.CityView;
import com.gastronomico.directory.service.CityService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * City CRUD. Each successful write is broadcast before the response is
 * returned, so an SSE client may see its own change first.
 */
@RestController
@RequestMapping("/api/cities")
public class CityController {

    private final CityService cityService;
    private final ChangeNotifier notifier;

    public CityController(CityService cityService, ChangeNotifier notifier) {
        this.cityService = cityService;
        this.notifier = notifier;
    }

    @GetMapping
    public List<CityView> list() {
        return cityService.findAll();
    }

    @GetMapping("/search")
    public List<CityView> search(@RequestParam(name = "q", required = false) String query) {
        return cityService.search(query);
    }

    @GetMapping("/{id}")
    public CityView get(@PathVariable Long id) {
        return cityService.findById(id);
    }

    @PostMapping
    public ResponseEntity<CityView> create(@RequestBody CityRequest request) {
        CityView city = cityService.create(request);
        notifier.publish(EventTypes.CITY_CREATED, city);
        return ResponseEntity.status(HttpStatus.CREATED).body(city);
    }

    @PutMapping("/{id}")
    public CityView update(@PathVariable Long id, @RequestBody CityRequest request) {
        CityView city = cityService.update(id, request);
        notifier.publish(EventTypes.CITY_UPDATED, city);
        return city;
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable Long id) {
        cityService.delete(id);
        notifier.publish(EventTypes.CITY_DELETED, Map.of("id", id, "message", "City deleted"));
        return Map.of("message", "City deleted successfully");
    }
}
