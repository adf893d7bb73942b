package com.multiquery.api;

import com.multiquery.model.BackendId;
import com.multiquery.model.SelectionMask;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Wire form of a {@link SelectionMask}: {@code {"mode": "all|include|exclude", "backends": [...]}}.
 */
@Data
public class SelectionRequest {
    private String mode = "all";
    private List<String> backends = new ArrayList<>();

    public SelectionMask toMask() {
        String m = mode == null || mode.isBlank() ? "all" : mode.trim().toLowerCase(Locale.ROOT);
        List<BackendId> ids = backends == null ? List.of() : backends.stream()
                .map(BackendId::of)
                .collect(Collectors.toList());
        switch (m) {
            case "all":
                return SelectionMask.all();
            case "include":
                return SelectionMask.include(ids);
            case "exclude":
                return SelectionMask.exclude(ids);
            default:
                throw new IllegalArgumentException("Unsupported selection mode: " + mode + " (expected all, include or exclude)");
        }
    }
}
