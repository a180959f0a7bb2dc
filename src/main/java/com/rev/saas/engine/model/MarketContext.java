package com.rev.saas.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketContext {
    private String type;    // b2b / b2c
    private String segment; // saas, ecommerce, ...
}
