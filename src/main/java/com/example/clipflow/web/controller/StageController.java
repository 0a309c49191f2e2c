package com.example.clipflow.web.controller;

import com.example.clipflow.web.dto.StageDescriptor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class StageController {

    @GetMapping("/api/stages")
    public ResponseEntity<List<StageDescriptor>> listStages() {
        return ResponseEntity.ok(StageDescriptor.all());
    }
}
