package com.example.framepickr_backend.dto.web;

public record SavedView(String filename, String savedAs, String url, double score) {
}
