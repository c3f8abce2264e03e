package com.bizplanner.orchestrator.model.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;

/**
 * Root of {@code rules/lookup-tables.yaml}. Entries keep file order, which
 * decides the winner of a substring lookup.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LookupTablesDefinition {
    private LinkedHashMap<String, LinkedHashMap<String, Object>> tables = new LinkedHashMap<>();
}
