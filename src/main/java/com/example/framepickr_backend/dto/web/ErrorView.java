package com.example.framepickr_backend.dto.web;

public record ErrorView(String filename, String reason) {
}
