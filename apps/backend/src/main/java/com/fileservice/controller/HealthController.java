package com.fileservice.controller;

import com.fileservice.storage.StorageBackend;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 存活探针，不访问数据库与存储。
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final StorageBackend storage;

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("service", "file-service");
        response.put("storage_type", storage.storageType().tag());
        response.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(response);
    }
}
