package com.adpanel.service.sync;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.adpanel.client.AdPlatformConnector;
import com.adpanel.dto.platform.FetchResult;
import com.adpanel.dto.platform.PlatformAd;
import com.adpanel.dto.platform.PlatformPost;
import com.adpanel.dto.sync.AdSummary;
import com.adpanel.dto.sync.LinkResult;
import com.adpanel.dto.sync.ReconciledAd;
import com.adpanel.entity.Ad;
import com.adpanel.entity.AdAccount;
import com.adpanel.entity.AdCategory;
import com.adpanel.entity.Content;
import com.adpanel.entity.EntityStatus;
import com.adpanel.entity.Platform;
import com.adpanel.repository.jpa.AdRepository;
import com.adpanel.service.content.ContentService;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ContentLinkerTest {

    @Mock private ContentService contentService;
    @Mock private AdRepository adRepository;
    @Mock private AdPlatformConnector connector;

    private ContentLinker linker;
    private AdAccount account;

    @BeforeEach
    void setUp() {
        linker = new ContentLinker(contentService, adRepository, new AdNameParser());
        account =
                AdAccount.builder()
                        .id(1L)
                        .platform(Platform.TIKTOK)
                        .externalAccountId("7000000001")
                        .build();
    }

    @Test
    @DisplayName("known posts are linked and their summaries attached by category")
    void link_attachesSummaries() {
        // Arrange
        Content content = Content.builder().id(10L).platformPostId("post-1").build();
        when(contentService.findByExternalPostIds(eq(Platform.TIKTOK), any()))
                .thenReturn(Map.of("post-1", content));
        ReconciledAd abx = reconciled(1L, "a-1", "post-1", AdCategory.ABX);

        // Act
        LinkResult result = linker.link(account, List.of(abx), connector);

        // Assert
        assertEquals(1, result.getLinked());
        assertEquals(0, result.getUnresolved());
        assertSame(content, abx.ad().getContent());
        ArgumentCaptor<AdSummary> summary = ArgumentCaptor.forClass(AdSummary.class);
        verify(contentService).attachAdSummary(eq(10L), summary.capture(), eq(AdCategory.ABX));
        assertEquals("a-1", summary.getValue().getAdId());
        verify(contentService).refreshAdAggregates(10L, "J3");
        verifyNoInteractions(connector);
    }

    @Test
    @DisplayName("missing posts are fetched once; ids still missing are counted as unresolved")
    void link_fetchesMissingOnce() {
        // Arrange
        Content created = Content.builder().id(11L).platformPostId("post-2").build();
        when(contentService.findByExternalPostIds(eq(Platform.TIKTOK), any()))
                .thenReturn(Map.of())
                .thenReturn(Map.of("post-2", created));
        FetchResult<PlatformPost> details = new FetchResult<>();
        details.add(post("post-2"));
        when(connector.fetchPostDetails("7000000001", List.of("post-2", "post-3"))).thenReturn(details);

        List<ReconciledAd> ads =
                List.of(
                        reconciled(1L, "a-1", "post-2", AdCategory.ACE),
                        reconciled(2L, "a-2", "post-3", AdCategory.ACE),
                        reconciled(3L, "a-3", null, AdCategory.GENERAL));

        // Act
        LinkResult result = linker.link(account, ads, connector);

        // Assert
        verify(connector, times(1)).fetchPostDetails(anyString(), anyList());
        verify(contentService).createFromPost(eq(Platform.TIKTOK), eq(1L), any(PlatformPost.class));
        assertEquals(1, result.getContentCreated());
        assertEquals(1, result.getLinked());
        assertEquals(1, result.getUnresolved());
        assertEquals(1, result.getWithoutPost());
    }

    @Test
    @DisplayName("a failing ad is counted and the rest are still linked")
    void link_isolatesFailures() {
        // Arrange
        Content content = Content.builder().id(10L).platformPostId("post-1").build();
        when(contentService.findByExternalPostIds(eq(Platform.TIKTOK), any()))
                .thenReturn(Map.of("post-1", content));
        when(contentService.attachAdSummary(eq(10L), argThat(s -> "a-1".equals(s.getAdId())), any()))
                .thenThrow(new IllegalStateException("boom"));

        List<ReconciledAd> ads =
                List.of(
                        reconciled(1L, "a-1", "post-1", AdCategory.ABX),
                        reconciled(2L, "a-2", "post-1", AdCategory.ABX));

        // Act
        LinkResult result = linker.link(account, ads, connector);

        // Assert
        assertEquals(1, result.getFailed());
        assertEquals(1, result.getLinked());
    }

    private static ReconciledAd reconciled(Long id, String externalId, String postId, AdCategory category) {
        PlatformAd source =
                new PlatformAd(
                        externalId,
                        "g-1",
                        "c-1",
                        "[J3]_ABX_VV_SALE#01",
                        "[J3]_ABX_VV_SALE#01",
                        "J3 March",
                        postId,
                        "ENABLE",
                        null);
        Ad ad =
                Ad.builder()
                        .id(id)
                        .externalAdId(externalId)
                        .name(source.name())
                        .status(EntityStatus.ACTIVE)
                        .category(category)
                        .spend(BigDecimal.ZERO)
                        .build();
        return new ReconciledAd(ad, source, category);
    }

    private static PlatformPost post(String id) {
        return new PlatformPost(
                id, null, "caption", null, 1000, 1000, 1000, 10, 2, 1, 1, 0, null, null);
    }
}
