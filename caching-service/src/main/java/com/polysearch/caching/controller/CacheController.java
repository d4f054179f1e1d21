package com.polysearch.caching.controller;

import com.polysearch.caching.service.CacheService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/cache")
public class CacheController {

    private final CacheService cacheService;

    public CacheController(CacheService cacheService) {
        this.cacheService = cacheService;
    }

    @PostMapping(value = "/put", consumes = MediaType.APPLICATION_JSON_VALUE)
    public String put(
            @RequestParam("key") String key,
            @RequestBody String value,
            @RequestParam(value = "ttl", required = false) Long ttl
    ) {
        cacheService.put(key, value, ttl);
        return "Cached successfully";
    }

    // A miss answers 204 so clients read an empty body.
    @GetMapping(value = "/get", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> get(@RequestParam("key") String key) {
        String value = cacheService.get(key);
        if (value == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(value);
    }

    @DeleteMapping("/evict")
    public String evict(@RequestParam("key") String key) {
        return cacheService.evict(key) ? "Key evicted" : "Key not present";
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ex.getMessage());
    }
}
