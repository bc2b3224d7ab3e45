package com.ecgheartbeat.backend.controller;

import com.ecgheartbeat.backend.dto.ApiResponse;
import com.ecgheartbeat.backend.dto.EcgResultDto;
import com.ecgheartbeat.backend.dto.SaveEcgRequest;
import com.ecgheartbeat.backend.service.EcgService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/ecg")
@RequiredArgsConstructor
public class EcgController {

    private final EcgService ecgService;

    @PostMapping("/save")
    public ResponseEntity<ApiResponse> save(@Valid @RequestBody SaveEcgRequest request) {
        EcgResultDto result = EcgResultDto.fromEntity(ecgService.save(request));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("ECG result saved successfully").with("result", result));
    }

    @GetMapping("/history/{userId}")
    public ResponseEntity<ApiResponse> getHistory(@PathVariable Long userId) {
        List<EcgResultDto> history = ecgService.getHistory(userId).stream()
                .map(EcgResultDto::fromEntity)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("ECG history retrieved successfully")
                .with("history", history)
                .with("count", history.size()));
    }

    @DeleteMapping("/history/{userId}")
    public ResponseEntity<ApiResponse> deleteHistory(@PathVariable Long userId) {
        EcgService.HistoryPurge purge = ecgService.deleteHistory(userId);
        return ResponseEntity.ok(ApiResponse.success("ECG history deleted successfully")
                .with("deletedCount", purge.deletedCount())
                .with("previousCount", purge.previousCount()));
    }

    @DeleteMapping("/history/{userId}/{id}")
    public ResponseEntity<ApiResponse> deleteRecord(@PathVariable Long userId, @PathVariable Long id) {
        Long deletedId = ecgService.deleteRecord(userId, id);
        return ResponseEntity.ok(ApiResponse.success("ECG record deleted successfully")
                .with("deletedRecordId", deletedId));
    }
}
