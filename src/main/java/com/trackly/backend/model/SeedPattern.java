package com.trackly.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Compiled-in prior knowledge of the tracks a branch usually departs from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeedPattern {
    private List<String> tracks;
    private Integer confidence; // null means the catalog default
}
