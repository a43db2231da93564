package com.gastronomico.directory.controller;

import com.gastronomico.directory.events.ChangeNotifier;
import com.gastronomico.directory.events.EventTypes;
import com.gastronomico.directory.model.RestaurantRequest;
import com.gastronomico.directory.model.RestaurantView;
import com.gastronomico.directory.service.RestaurantService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/restaurants")
public class RestaurantController {

    private final RestaurantService restaurantService;
    private final ChangeNotifier notifier;

    public RestaurantController(RestaurantService restaurantService, ChangeNotifier notifier) {
        this.restaurantService = restaurantService;
        this.notifier = notifier;
    }

    @GetMapping
    public List<RestaurantView> list() {
        return restaurantService.findAll();
    }

    // Literal path, so it wins over /{id}
    @GetMapping("/search")
    public List<RestaurantView> search(@RequestParam(name = "q", required = false) String query) {
        return restaurantService.search(query);
    }

    @GetMapping("/{id}")
    public RestaurantView get(@PathVariable Long id) {
        return restaurantService.findById(id);
    }

    @PostMapping
    public ResponseEntity<RestaurantView> create(@RequestBody RestaurantRequest request) {
        RestaurantView restaurant = restaurantService.create(request);
        notifier.publish(EventTypes.RESTAURANT_CREATED, restaurant);
        return ResponseEntity.status(HttpStatus.CREATED).body(restaurant);
    }

    @PutMapping("/{id}")
    public RestaurantView update(@PathVariable Long id, @RequestBody RestaurantRequest request) {
        RestaurantView restaurant = restaurantService.update(id, request);
        notifier.publish(EventTypes.RESTAURANT_UPDATED, restaurant);
        return restaurant;
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable Long id) {
        restaurantService.delete(id);
        notifier.publish(EventTypes.RESTAURANT_DELETED, Map.of("id", id, "message", "Restaurant deleted"));
        return Map.of("message", "Restaurant deleted successfully");
    }
}
