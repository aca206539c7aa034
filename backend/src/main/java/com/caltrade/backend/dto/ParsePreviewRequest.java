package com.caltrade.backend.dto;

public record ParsePreviewRequest(String title, String description) {
}
