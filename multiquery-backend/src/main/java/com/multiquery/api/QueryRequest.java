package com.multiquery.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class QueryRequest {
    @NotBlank(message = "Query is required")
    private String query;

    @Valid
    @NotNull(message = "Selection is required")
    private SelectionRequest selection = new SelectionRequest();
}
