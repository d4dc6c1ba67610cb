package com.adpanel.dto.sync;

import com.adpanel.dto.platform.PlatformAd;
import com.adpanel.entity.Ad;
import com.adpanel.entity.AdCategory;

/** A stored ad together with the platform row it was reconciled from. */
public record ReconciledAd(Ad ad, PlatformAd source, AdCategory category) {}
