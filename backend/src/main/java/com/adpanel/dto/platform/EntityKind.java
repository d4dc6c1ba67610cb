package com.adpanel.dto.platform;

/**
 * Platform entity list that can be paged through, tied to the record type it parses into.
 *
 * @param <T> parsed row type
 */
public final class EntityKind<T extends PlatformRecord> {

    public static final EntityKind<PlatformCampaign> CAMPAIGN =
            new EntityKind<>("campaign", "/campaign/get/", "campaign_ids", PlatformCampaign.class);

    public static final EntityKind<PlatformAdGroup> AD_GROUP =
            new EntityKind<>("adgroup", "/adgroup/get/", "adgroup_ids", PlatformAdGroup.class);

    public static final EntityKind<PlatformAd> AD =
            new EntityKind<>("ad", "/ad/get/", "ad_ids", PlatformAd.class);

    private final String name;
    private final String listPath;
    private final String idFilterKey;
    private final Class<T> type;

    private EntityKind(String name, String listPath, String idFilterKey, Class<T> type) {
        this.name = name;
        this.listPath = listPath;
        this.idFilterKey = idFilterKey;
        this.type = type;
    }

    public String name() {
        return name;
    }

    public String listPath() {
        return listPath;
    }

    public String idFilterKey() {
        return idFilterKey;
    }

    public Class<T> type() {
        return type;
    }

    @Override
    public String toString() {
        return name;
    }
}
