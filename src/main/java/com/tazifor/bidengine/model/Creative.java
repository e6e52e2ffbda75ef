package com.tazifor.bidengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Creative reference supplied by the external creative service. {@code adm} is opaque markup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Creative {
    private String id;
    private String adm;
    private Integer w;
    private Integer h;
}
