package com.rev.saas.engine.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionPage {
    private List<DecisionListItem> items;
    private long total;
    private int page;
    private int pageSize;
    private int totalPages;
}
