package com.adpanel.client;

import com.adpanel.config.AppProperties;
import com.adpanel.dto.platform.AdSpend;
import com.adpanel.dto.platform.BudgetUpdate;
import com.adpanel.dto.platform.DateWindow;
import com.adpanel.dto.platform.EntityKind;
import com.adpanel.dto.platform.FetchResult;
import com.adpanel.dto.platform.PlatformAd;
import com.adpanel.dto.platform.PlatformAdGroup;
import com.adpanel.dto.platform.PlatformCampaign;
import com.adpanel.dto.platform.PlatformPost;
import com.adpanel.dto.platform.PlatformRecord;
import com.adpanel.dto.platform.WriteResult;
import com.adpanel.entity.EntityStatus;
import com.adpanel.entity.Platform;
import com.adpanel.exception.PlatformApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * TikTok Business API client. List endpoints answer {@code {code, message, data: {list,
 * page_info}}}; a non-zero {@code code} is an API error even on HTTP 200.
 */
@Slf4j
@Component
public class TikTokAdsClient implements AdPlatformConnector {

    private static final String ACCESS_TOKEN_HEADER = "Access-Token";
    private static final String REPORT_PATH = "/report/integrated/get/";
    private static final String POST_LIST_PATH = "/business/video/list/";
    private static final String BUDGET_UPDATE_PATH = "/adgroup/budget/update/";
    private static final String STATUS_UPDATE_PATH = "/adgroup/status/update/";

    private static final DateTimeFormatter PLATFORM_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private static final List<String> CAMPAIGN_FIELDS =
            List.of(
                    "campaign_id",
                    "campaign_name",
                    "operation_status",
                    "objective_type",
                    "budget_mode",
                    "budget");
    private static final List<String> AD_GROUP_FIELDS =
            List.of(
                    "adgroup_id",
                    "campaign_id",
                    "adgroup_name",
                    "operation_status",
                    "optimization_goal",
                    "budget_mode",
                    "budget");
    private static final List<String> AD_FIELDS =
            List.of(
                    "ad_id",
                    "adgroup_id",
                    "campaign_id",
                    "ad_name",
                    "adgroup_name",
                    "campaign_name",
                    "tiktok_item_id",
                    "operation_status",
                    "create_time");
    private static final List<String> POST_FIELDS =
            List.of(
                    "item_id",
                    "create_time",
                    "share_url",
                    "caption",
                    "video_views",
                    "reach",
                    "likes",
                    "comments",
                    "shares",
                    "favorites",
                    "video_duration",
                    "average_time_watched");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final Retry readRetry;
    private final Retry writeRetry;
    private final AppProperties appProperties;

    @Value("${app.platform.api.url}")
    private String apiUrl;

    @Value("${app.platform.api.access-token:}")
    private String accessToken;

    public TikTokAdsClient(
            @Qualifier("platformRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            @Qualifier("platformCircuitBreaker") CircuitBreaker circuitBreaker,
            @Qualifier("platformReadRetry") Retry readRetry,
            @Qualifier("platformWriteRetry") Retry writeRetry,
            AppProperties appProperties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.readRetry = readRetry;
        this.writeRetry = writeRetry;
        this.appProperties = appProperties;
    }

    @Override
    public Platform platform() {
        return Platform.TIKTOK;
    }

    @Override
    public <T extends PlatformRecord> FetchResult<T> fetchEntities(
            String accountId, EntityKind<T> kind, DateWindow window, List<String> idFilter) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("advertiser_id", accountId);
        params.put("fields", toJson(fieldsFor(kind)));

        Map<String, Object> filtering = new LinkedHashMap<>();
        if (window != null) {
            filtering.put(
                    "creation_filter_start_time", window.start().atStartOfDay().format(PLATFORM_TIME));
            filtering.put(
                    "creation_filter_end_time", window.end().atTime(23, 59, 59).format(PLATFORM_TIME));
        }
        if (idFilter != null) {
            filtering.put(kind.idFilterKey(), idFilter);
        }
        if (!filtering.isEmpty()) {
            params.put("filtering", toJson(filtering));
        }

        FetchResult<T> result = pageThrough(kind.listPath(), params, row -> parse(kind, row));
        log.debug("Fetched {} for account {}: {}", kind, accountId, result);
        return result;
    }

    @Override
    public <T extends PlatformRecord> FetchResult<T> fetchByIds(
            String accountId, EntityKind<T> kind, List<String> ids) {
        return inBatches(ids, batch -> fetchEntities(accountId, kind, null, batch));
    }

    @Override
    public FetchResult<AdSpend> fetchLifetimeSpend(String accountId, List<String> adIds) {
        return inBatches(
                adIds,
                batch -> {
                    Map<String, Object> adFilter = new LinkedHashMap<>();
                    adFilter.put("field_name", "ad_ids");
                    adFilter.put("filter_type", "IN");
                    adFilter.put("filter_value", toJson(batch));

                    Map<String, String> params = new LinkedHashMap<>();
                    params.put("advertiser_id", accountId);
                    params.put("report_type", "BASIC");
                    params.put("data_level", "AUCTION_AD");
                    params.put("dimensions", toJson(List.of("ad_id")));
                    params.put("metrics", toJson(List.of("spend")));
                    params.put("query_lifetime", "true");
                    params.put("filtering", toJson(List.of(adFilter)));
                    return pageThrough(REPORT_PATH, params, this::parseSpend);
                });
    }

    @Override
    public FetchResult<PlatformPost> fetchPostDetails(String accountId, List<String> postIds) {
        return inBatches(
                postIds,
                batch -> {
                    Map<String, String> params = new LinkedHashMap<>();
                    params.put("business_id", accountId);
                    params.put("fields", toJson(POST_FIELDS));
                    params.put("filters", toJson(Map.of("video_ids", batch)));
                    return pageThrough(POST_LIST_PATH, params, this::parsePost);
                });
    }

    @Override
    public WriteResult updateAdGroupBudgets(String accountId, List<BudgetUpdate> updates) {
        int succeeded = 0;
        List<String> failedIds = new ArrayList<>();
        String lastError = null;

        for (List<BudgetUpdate> batch : partition(updates, maxItemsPerWrite())) {
            List<Map<String, Object>> budgets = new ArrayList<>();
            for (BudgetUpdate update : batch) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("adgroup_id", update.adGroupId());
                entry.put("budget", update.budget());
                budgets.add(entry);
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("advertiser_id", accountId);
            body.put("budget", budgets);

            try {
                post(BUDGET_UPDATE_PATH, body);
                succeeded += batch.size();
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                batch.forEach(update -> failedIds.add(update.adGroupId()));
                log.error(
                        "Budget update of {} ad groups failed for account {}: {}",
                        batch.size(),
                        accountId,
                        e.getMessage());
            }
        }
        return new WriteResult(updates.size(), succeeded, failedIds, lastError);
    }

    @Override
    public WriteResult updateAdGroupStatus(
            String accountId, List<String> adGroupIds, EntityStatus status) {
        String operation = toOperationStatus(status);
        int succeeded = 0;
        List<String> failedIds = new ArrayList<>();
        String lastError = null;

        for (List<String> batch : partition(adGroupIds, maxItemsPerWrite())) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("advertiser_id", accountId);
            body.put("adgroup_ids", batch);
            body.put("operation_status", operation);

            try {
                post(STATUS_UPDATE_PATH, body);
                succeeded += batch.size();
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                failedIds.addAll(batch);
                log.error(
                        "Status update to {} of {} ad groups failed for account {}: {}",
                        operation,
                        batch.size(),
                        accountId,
                        e.getMessage());
            }
        }
        return new WriteResult(adGroupIds.size(), succeeded, failedIds, lastError);
    }

    /**
     * Reads pages until the platform reports the last one or the page ceiling is reached. A
     * failing page ends the loop; rows from earlier pages are kept.
     */
    private <T> FetchResult<T> pageThrough(
            String path, Map<String, String> baseParams, Function<Map<String, Object>, T> parser) {
        FetchResult<T> result = new FetchResult<>();
        int maxPages = appProperties.getPlatform().getMaxPages();
        int page = 1;

        while (true) {
            if (page > maxPages) {
                result.markCeilingHit();
                log.warn("Page ceiling of {} reached for {}, stopping", maxPages, path);
                break;
            }

            Map<String, String> params = new LinkedHashMap<>(baseParams);
            params.put("page", String.valueOf(page));
            params.put("page_size", String.valueOf(appProperties.getPlatform().getPageSize()));

            Map<String, Object> data;
            try {
                data = get(path, params);
            } catch (RuntimeException e) {
                log.error("Fetching page {} of {} failed: {}", page, path, e.getMessage());
                result.fail(e.getMessage(), e);
                break;
            }
            result.pageFetched();

            for (Map<String, Object> row : castToListOfMaps(data.get("list"))) {
                T item = parser.apply(row);
                if (item == null) {
                    result.skip();
                } else {
                    result.add(item);
                }
            }

            int totalPage = getIntValue(castToMap(data.get("page_info")), "total_page", 1);
            log.debug("Read page {}/{} of {}", page, totalPage, path);
            if (page >= totalPage) {
                break;
            }
            page++;
        }
        return result;
    }

    private <T> FetchResult<T> inBatches(
            List<String> ids, Function<List<String>, FetchResult<T>> fetcher) {
        FetchResult<T> merged = new FetchResult<>();
        if (ids == null || ids.isEmpty()) {
            return merged;
        }
        List<String> distinct = ids.stream().distinct().collect(Collectors.toList());
        for (List<String> batch : partition(distinct, appProperties.getPlatform().getMaxIdsPerRequest())) {
            merged.merge(fetcher.apply(batch));
            if (merged.hasError()) {
                break;
            }
        }
        return merged;
    }

    private Map<String, Object> get(String path, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(apiUrl + path);
        for (Map.Entry<String, String> param : params.entrySet()) {
            builder.queryParam(param.getKey(), param.getValue());
        }
        URI uri = builder.build().encode().toUri();

        return circuitBreaker.executeSupplier(
                () -> readRetry.executeSupplier(() -> exchange(HttpMethod.GET, uri, null, path)));
    }

    private Map<String, Object> post(String path, Map<String, Object> body) {
        URI uri = UriComponentsBuilder.fromHttpUrl(apiUrl + path).build().toUri();

        return circuitBreaker.executeSupplier(
                () -> writeRetry.executeSupplier(() -> exchange(HttpMethod.POST, uri, body, path)));
    }

    private Map<String, Object> exchange(
            HttpMethod method, URI uri, Map<String, Object> body, String endpoint) {
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(body, createAuthHeaders());
        ResponseEntity<Map<String, Object>> response;
        try {
            response = restTemplate.exchange(uri, method, entity, JSON_OBJECT);
        } catch (HttpStatusCodeException e) {
            throw new PlatformApiException(
                    Platform.TIKTOK,
                    "HTTP " + e.getStatusCode().value() + " from " + endpoint + ": "
                            + e.getResponseBodyAsString(),
                    HttpStatus.resolve(e.getStatusCode().value()),
                    null,
                    endpoint);
        } catch (ResourceAccessException e) {
            throw new PlatformApiException(
                    Platform.TIKTOK, "I/O error calling " + endpoint + ": " + e.getMessage(), endpoint, e);
        }
        return validateResponseBody(response, endpoint);
    }

    private Map<String, Object> validateResponseBody(
            ResponseEntity<Map<String, Object>> response, String endpoint) {
        HttpStatus status = HttpStatus.resolve(response.getStatusCode().value());
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new PlatformApiException(
                    Platform.TIKTOK,
                    "Unexpected status " + response.getStatusCode().value() + " from " + endpoint,
                    status,
                    null,
                    endpoint);
        }

        Map<String, Object> body = response.getBody();
        if (body == null) {
            throw new PlatformApiException(
                    Platform.TIKTOK, "Empty response body from " + endpoint, status, null, endpoint);
        }

        int code = getIntValue(body, "code", -1);
        if (code != 0) {
            log.warn(
                    "Platform API error in response body for {}: {} (code: {}, request: {})",
                    endpoint,
                    body.get("message"),
                    code,
                    body.get("request_id"));
            throw new PlatformApiException(
                    Platform.TIKTOK,
                    "API Error " + code + ": " + body.get("message"),
                    status,
                    String.valueOf(code),
                    endpoint);
        }

        return castToMap(body.get("data"));
    }

    private HttpHeaders createAuthHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (accessToken == null || accessToken.isBlank()) {
            log.warn("Platform access token not configured - set PLATFORM_ACCESS_TOKEN");
        } else {
            headers.set(ACCESS_TOKEN_HEADER, accessToken);
        }
        return headers;
    }

    private static List<String> fieldsFor(EntityKind<?> kind) {
        if (kind == EntityKind.CAMPAIGN) return CAMPAIGN_FIELDS;
        if (kind == EntityKind.AD_GROUP) return AD_GROUP_FIELDS;
        return AD_FIELDS;
    }

    private <T extends PlatformRecord> T parse(EntityKind<T> kind, Map<String, Object> row) {
        PlatformRecord parsed;
        if (kind == EntityKind.CAMPAIGN) {
            parsed = parseCampaign(row);
        } else if (kind == EntityKind.AD_GROUP) {
            parsed = parseAdGroup(row);
        } else {
            parsed = parseAd(row);
        }
        return parsed == null ? null : kind.type().cast(parsed);
    }

    private PlatformCampaign parseCampaign(Map<String, Object> row) {
        String id = getString(row, "campaign_id");
        if (id == null) {
            log.debug("Skipping campaign row without id: {}", row);
            return null;
        }
        return new PlatformCampaign(
                id,
                getString(row, "campaign_name"),
                getString(row, "operation_status"),
                getString(row, "objective_type"),
                getString(row, "budget_mode"),
                getDecimal(row, "budget"));
    }

    private PlatformAdGroup parseAdGroup(Map<String, Object> row) {
        String id = getString(row, "adgroup_id");
        String campaignId = getString(row, "campaign_id");
        if (id == null || campaignId == null) {
            log.debug("Skipping ad group row without id or campaign: {}", row);
            return null;
        }
        return new PlatformAdGroup(
                id,
                campaignId,
                getString(row, "adgroup_name"),
                getString(row, "operation_status"),
                getString(row, "optimization_goal"),
                getString(row, "budget_mode"),
                getDecimal(row, "budget"));
    }

    private PlatformAd parseAd(Map<String, Object> row) {
        String id = getString(row, "ad_id");
        String adGroupId = getString(row, "adgroup_id");
        String campaignId = getString(row, "campaign_id");
        if (id == null || adGroupId == null || campaignId == null) {
            log.debug("Skipping ad row with missing ids: {}", row);
            return null;
        }
        return new PlatformAd(
                id,
                adGroupId,
                campaignId,
                getString(row, "ad_name"),
                getString(row, "adgroup_name"),
                getString(row, "campaign_name"),
                getString(row, "tiktok_item_id"),
                getString(row, "operation_status"),
                getTimestamp(row, "create_time"));
    }

    private AdSpend parseSpend(Map<String, Object> row) {
        String adId = getString(castToMap(row.get("dimensions")), "ad_id");
        if (adId == null) {
            return null;
        }
        BigDecimal spend = getDecimal(castToMap(row.get("metrics")), "spend");
        return new AdSpend(adId, spend != null ? spend : BigDecimal.ZERO);
    }

    private PlatformPost parsePost(Map<String, Object> row) {
        String id = getString(row, "item_id");
        if (id == null) {
            return null;
        }
        long views = getLongValue(row, "video_views", 0L);
        long reach = getLongValue(row, "reach", 0L);
        return new PlatformPost(
                id,
                getString(row, "share_url"),
                getString(row, "caption"),
                getTimestamp(row, "create_time"),
                views,
                // Accounts without reach reporting fall back to views
                reach > 0 ? reach : views,
                getLongValue(row, "impressions", views),
                getLongValue(row, "likes", 0L),
                getLongValue(row, "comments", 0L),
                getLongValue(row, "shares", 0L),
                getLongValue(row, "favorites", 0L),
                getLongValue(row, "clicks", 0L),
                getDecimal(row, "video_duration"),
                getDecimal(row, "average_time_watched"));
    }

    private static String toOperationStatus(EntityStatus status) {
        switch (status) {
            case ACTIVE:
                return "ENABLE";
            case PAUSED:
                return "DISABLE";
            case DELETED:
                return "DELETE";
            default:
                throw new IllegalArgumentException("Status cannot be written to platform: " + status);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize request parameter", e);
        }
    }

    private int maxItemsPerWrite() {
        return appProperties.getPlatform().getMaxItemsPerWrite();
    }

    private static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            batches.add(items.subList(i, Math.min(i + size, items.size())));
        }
        return batches;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> castToListOfMaps(Object obj) {
        if (!(obj instanceof List)) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Object item : (List<Object>) obj) {
            if (item instanceof Map) {
                rows.add((Map<String, Object>) item);
            }
        }
        return rows;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> castToMap(Object obj) {
        return obj instanceof Map ? (Map<String, Object>) obj : Collections.emptyMap();
    }

    private int getIntValue(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private long getLongValue(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return new BigDecimal(value.toString().trim()).longValue();
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private BigDecimal getDecimal(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {}: {}", key, value);
            return null;
        }
    }

    private String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    /** Accepts both "yyyy-MM-dd HH:mm:ss" and epoch seconds. */
    private LocalDateTime getTimestamp(Map<String, Object> map, String key) {
        String raw = getString(map, key);
        if (raw == null) return null;
        try {
            if (raw.chars().allMatch(Character::isDigit)) {
                return LocalDateTime.ofInstant(
                        Instant.ofEpochSecond(Long.parseLong(raw)), ZoneId.of("UTC"));
            }
            return LocalDateTime.parse(raw, PLATFORM_TIME);
        } catch (DateTimeParseException | NumberFormatException e) {
            log.debug("Ignoring unparseable {}: {}", key, raw);
            return null;
        }
    }
}
