package com.catdb.api;

import com.catdb.model.PendingEdit;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RowUpdatesRequest {
    @NotEmpty(message = "At least one edit is required")
    private List<PendingEdit> edits = new ArrayList<>();
}
