package com.example.mediareconcile.application.service;

import com.example.mediareconcile.common.config.AppMatchProperties;
import com.example.mediareconcile.common.exception.BusinessException;
import com.example.mediareconcile.domain.model.CatalogFetchResult;
import com.example.mediareconcile.domain.model.CatalogTrack;
import com.example.mediareconcile.domain.model.CategoryScan;
import com.example.mediareconcile.domain.model.FuzzyMatch;
import com.example.mediareconcile.domain.model.MatchResult;
import com.example.mediareconcile.domain.model.MediaFile;
import com.example.mediareconcile.domain.model.TagRecord;
import com.example.mediareconcile.infrastructure.catalog.CatalogClient;
import com.example.mediareconcile.infrastructure.catalog.UnconfiguredCatalogClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Matches the tracks of a local category against an external catalog: exact identity set
 * operations first, then a fuzzy pass over the leftovers.
 */
@Service
public class CatalogMatchService {

    private static final Logger log = LoggerFactory.getLogger(CatalogMatchService.class);

    private static final String ARTIST_SEPARATOR = ", ";

    private final DirectoryScanService directoryScanService;
    private final IdentityNormalizer identityNormalizer;
    private final SimilarityCalculator similarityCalculator;
    private final CatalogClient catalogClient;
    private final AppMatchProperties matchProperties;
    private final MeterRegistry meterRegistry;

    public CatalogMatchService(DirectoryScanService directoryScanService,
                               IdentityNormalizer identityNormalizer,
                               SimilarityCalculator similarityCalculator,
                               ObjectProvider<CatalogClient> catalogClientProvider,
                               AppMatchProperties matchProperties,
                               ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.directoryScanService = directoryScanService;
        this.identityNormalizer = identityNormalizer;
        this.similarityCalculator = similarityCalculator;
        this.catalogClient = catalogClientProvider.getIfAvailable(UnconfiguredCatalogClient::new);
        this.matchProperties = matchProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * Fetches the catalog playlist and matches it against the category. Without a playlist id the
     * catalog is empty and every local track ends up local-only.
     */
    public MatchResult matchWithCatalogPlaylist(String categoryKey, String catalogPlaylistId) {
        List<CatalogTrack> tracks = Collections.emptyList();
        if (StringUtils.hasText(catalogPlaylistId)) {
            tracks = fetchCatalogTracks(catalogPlaylistId);
        }
        return match(categoryKey, tracks);
    }

    public MatchResult match(String categoryKey, List<CatalogTrack> catalogTracks) {
        CategoryScan scan = directoryScanService.scanCategory(categoryKey);
        Set<String> local = localIdentities(scan.allFiles());
        Set<String> catalog = catalogIdentities(catalogTracks);
        MatchResult result = matchIdentities(local, catalog);
        log.info("CATALOG_MATCH_FINISH category={} local={} catalog={} matched={} localOnly={} catalogOnly={} fuzzy={}",
                categoryKey, local.size(), catalog.size(), result.getMatched().size(),
                result.getLocalOnly().size(), result.getCatalogOnly().size(), result.getFuzzyMatches().size());
        incrementCounter("media.match.fuzzy", result.getFuzzyMatches().size());
        return result;
    }

    /**
     * Pure matching over two identity sets. Output lists are sorted; the fuzzy pass walks the
     * catalog-only identities in that order and keeps the first candidate on an exact score tie.
     */
    public MatchResult matchIdentities(Collection<String> localIdentities, Collection<String> catalogIdentities) {
        TreeSet<String> local = new TreeSet<>(localIdentities);
        TreeSet<String> catalog = new TreeSet<>(catalogIdentities);

        TreeSet<String> matched = new TreeSet<>(local);
        matched.retainAll(catalog);
        TreeSet<String> localOnly = new TreeSet<>(local);
        localOnly.removeAll(catalog);
        TreeSet<String> catalogOnly = new TreeSet<>(catalog);
        catalogOnly.removeAll(local);

        MatchResult result = new MatchResult();
        result.setMatched(new ArrayList<>(matched));
        result.setLocalOnly(new ArrayList<>(localOnly));
        result.setCatalogOnly(new ArrayList<>(catalogOnly));

        double threshold = matchProperties.getFuzzyThreshold();
        for (String localIdentity : localOnly) {
            String bestMatch = null;
            double bestScore = 0.0D;
            for (String candidate : catalogOnly) {
                double score = similarityCalculator.ratio(localIdentity, candidate);
                if (score > bestScore && score > threshold) {
                    bestScore = score;
                    bestMatch = candidate;
                }
            }
            if (bestMatch != null) {
                result.getFuzzyMatches().put(localIdentity, new FuzzyMatch(bestMatch, bestScore));
                log.debug("FUZZY_MATCH local='{}' catalog='{}' score={}", localIdentity, bestMatch, bestScore);
            }
        }
        return result;
    }

    /**
     * Identity of every local file: tag title and artist, which fall back to the filename stem
     * and "Unknown" when tags could not be read.
     */
    public Set<String> localIdentities(List<MediaFile> files) {
        Set<String> identities = new TreeSet<>();
        for (MediaFile file : files) {
            TagRecord tags = file.getTags();
            String title = tags == null ? IdentityNormalizer.stemOf(file.getName()) : tags.getTitle();
            String artist = tags == null ? MetadataExtractionService.UNKNOWN : tags.getArtist();
            identities.add(identityNormalizer.normalizeTrack(title, artist));
        }
        return identities;
    }

    public Set<String> catalogIdentities(List<CatalogTrack> tracks) {
        Set<String> identities = new TreeSet<>();
        if (tracks == null) {
            return identities;
        }
        for (CatalogTrack track : tracks) {
            if (track == null) {
                continue;
            }
            identities.add(identityNormalizer.normalizeTrack(track.getTitle(), joinArtists(track.getArtists())));
        }
        return identities;
    }

    private static String joinArtists(List<String> artists) {
        if (artists == null) {
            return "";
        }
        List<String> names = new ArrayList<>();
        for (String artist : artists) {
            if (StringUtils.hasText(artist)) {
                names.add(artist);
            }
        }
        return String.join(ARTIST_SEPARATOR, names);
    }

    private List<CatalogTrack> fetchCatalogTracks(String catalogPlaylistId) {
        CatalogFetchResult fetched = catalogClient.fetchPlaylistTracks(catalogPlaylistId);
        if (fetched == null || fetched.getStatus() == null) {
            throw new BusinessException("502", "Catalog service returned no result");
        }
        switch (fetched.getStatus()) {
            case SUCCESS:
                return fetched.getTracks();
            case UNAUTHENTICATED:
                log.warn("CATALOG_FETCH_UNAUTHENTICATED playlistId={}", catalogPlaylistId);
                throw new BusinessException("401", "Not authenticated with the catalog service",
                        "Sign in to the catalog service and retry");
            case UNCONFIGURED:
                log.warn("CATALOG_FETCH_UNCONFIGURED playlistId={}", catalogPlaylistId);
                throw new BusinessException("503", "Catalog service is not configured",
                        "Configure catalog credentials");
            default:
                log.warn("CATALOG_FETCH_FAILED playlistId={} message={}", catalogPlaylistId, fetched.getMessage());
                throw new BusinessException("502", "Catalog service unavailable: " + fetched.getMessage(),
                        "Retry later");
        }
    }

    private void incrementCounter(String name, double amount) {
        if (meterRegistry == null || amount <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name).increment(amount);
        } catch (Exception ex) {
            log.debug("Match metric counter failed, name={}", name, ex);
        }
    }
}
