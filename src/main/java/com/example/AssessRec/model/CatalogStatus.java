package com.example.AssessRec.model;

public record CatalogStatus(boolean built, int count, String store) {
}
