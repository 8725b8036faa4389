package com.example.framepickr_backend.controller;

import com.example.framepickr_backend.dto.web.BatchResponse;
import com.example.framepickr_backend.exception.BatchCancelledException;
import com.example.framepickr_backend.model.ImageCandidate;
import com.example.framepickr_backend.model.SelectionResult;
import com.example.framepickr_backend.service.SelectionOrchestrator;
import com.example.framepickr_backend.util.BatchResponseMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

@RestController
public class ScoreController {
    static final int MAX_TOP_N = 20;

    private final SelectionOrchestrator orchestrator;

    public ScoreController(SelectionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Operation(summary = "Score a batch of photos, select the best and store them")
    @ApiResponse(responseCode = "200", description = "Batch scored; per-file failures are listed under errors")
    @ApiResponse(responseCode = "400", description = "top_n out of range or unreadable upload")
    @ApiResponse(responseCode = "503", description = "Batch abandoned while scoring")
    @PostMapping(value = "/score_and_save", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public BatchResponse scoreAndSave(@RequestPart(value = "files", required = false) List<MultipartFile> files,
                                      @RequestParam(value = "top_n", defaultValue = "5") int topN) {
        List<ImageCandidate> batch = toBatch(files, topN);
        return BatchResponseMapper.toResponse(run(() -> orchestrator.scoreAndSave(batch, topN)));
    }

    @Operation(summary = "Score and rank a batch of photos without storing anything")
    @ApiResponse(responseCode = "200", description = "Batch scored")
    @ApiResponse(responseCode = "400", description = "top_n out of range or unreadable upload")
    @PostMapping(value = "/score", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public BatchResponse score(@RequestPart(value = "files", required = false) List<MultipartFile> files,
                               @RequestParam(value = "top_n", defaultValue = "5") int topN) {
        List<ImageCandidate> batch = toBatch(files, topN);
        return BatchResponseMapper.toResponse(run(() -> orchestrator.scoreOnly(batch, topN)));
    }

    private static List<ImageCandidate> toBatch(List<MultipartFile> files, int topN) {
        if (topN < 1 || topN > MAX_TOP_N) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "TOP_N_OUT_OF_RANGE");
        }
        List<ImageCandidate> batch = new ArrayList<>();
        if (files == null) {
            return batch;
        }
        for (MultipartFile file : files) {
            try {
                batch.add(new ImageCandidate(batch.size(), file.getOriginalFilename(), file.getContentType(), file.getBytes()));
            } catch (IOException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "FILE_UNREADABLE", e);
            }
        }
        return batch;
    }

    private static SelectionResult run(Supplier<SelectionResult> call) {
        try {
            return call.get();
        } catch (BatchCancelledException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "BATCH_CANCELLED", e);
        }
    }
}
