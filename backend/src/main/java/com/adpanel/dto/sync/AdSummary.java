package com.adpanel.dto.sync;

import java.io.Serializable;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-ad entry stored in a content item's classification bucket. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdSummary implements Serializable {
    private String adId;
    private String adGroupId;
    private String campaignId;
    private String adName;
    private String adGroupName;
    private String campaignName;
    private String status;
    private BigDecimal cost;
}
