package com.gastronomico.directory.controller;

import com.gastronomico.directory.events.ChangeNotifier;
import com.gastronomico.directory.events.EventTypes;
import com.gastronomico.directory.model.SponsorRequest;
import com.gastronomico.directory.model.SponsorView;
import com.gastronomico.directory.service.SponsorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sponsors")
public class SponsorController {

    private final SponsorService sponsorService;
    private final ChangeNotifier notifier;

    public SponsorController(SponsorService sponsorService, ChangeNotifier notifier) {
        this.sponsorService = sponsorService;
        this.notifier = notifier;
    }

    @GetMapping
    public List<SponsorView> list() {
        return sponsorService.findAll();
    }

    /** Matches name, email or representative. */
    @GetMapping("/search")
    public List<SponsorView> search(@RequestParam(name = "q", required = false) String query) {
        return sponsorService.search(query);
    }

    @GetMapping("/{id}")
    public SponsorView get(@PathVariable Long id) {
        return sponsorService.findById(id);
    }

    @PostMapping
    public ResponseEntity<SponsorView> create(@RequestBody SponsorRequest request) {
        SponsorView sponsor = sponsorService.create(request);
        notifier.publish(EventTypes.SPONSOR_CREATED, sponsor);
        return ResponseEntity.status(HttpStatus.CREATED).body(sponsor);
    }

    @PutMapping("/{id}")
    public SponsorView update(@PathVariable Long id, @RequestBody SponsorRequest request) {
        SponsorView sponsor = sponsorService.update(id, request);
        notifier.publish(EventTypes.SPONSOR_UPDATED, sponsor);
        return sponsor;
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable Long id) {
        sponsorService.delete(id);
        notifier.publish(EventTypes.SPONSOR_DELETED, Map.of("id", id, "message", "Sponsor deleted"));
        return Map.of("message", "Sponsor deleted successfully");
    }
}
