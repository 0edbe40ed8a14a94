package com.catdb.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A row edit made in a result grid: the row's primary-key values and the new column values.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PendingEdit {
    private Map<String, Object> primaryKeyValues = new LinkedHashMap<>();
    private Map<String, Object> changedValues = new LinkedHashMap<>();
}
