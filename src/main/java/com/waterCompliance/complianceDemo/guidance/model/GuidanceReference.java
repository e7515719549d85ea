package com.waterCompliance.complianceDemo.guidance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuidanceReference {
    private String title;
    private String link;
    private String snippet;
    private String source;
}
