package com.multiquery.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackendsResponse {
    private List<BackendInfo> backends;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BackendInfo {
        private String id;
        private String kind;
    }
}
