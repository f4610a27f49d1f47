package com.example.AssessRec.model;

/**
 * Raw neighbor returned by a vector index.
 *
 * @param record   stored record
 * @param distance cosine distance to the query vector
 * @param ordinal  ingestion position, used to break distance ties
 */
public record IndexedNeighbor(AssessmentRecord record, double distance, long ordinal) {
}
