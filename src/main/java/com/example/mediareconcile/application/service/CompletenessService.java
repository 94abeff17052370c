package com.example.mediareconcile.application.service;

import com.example.mediareconcile.domain.model.CompletenessRecord;
import com.example.mediareconcile.domain.model.CompletenessReport;
import com.example.mediareconcile.domain.model.FormatKind;
import com.example.mediareconcile.domain.model.IdentityCollision;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Groups the files of a category by filename identity and reports which identities lack a format.
 */
@Service
public class CompletenessService {

    private static final Logger log = LoggerFactory.getLogger(CompletenessService.class);

    private final DirectoryScanService directoryScanService;
    private final IdentityNormalizer identityNormalizer;

    public CompletenessService(DirectoryScanService directoryScanService, IdentityNormalizer identityNormalizer) {
        this.directoryScanService = directoryScanService;
        this.identityNormalizer = identityNormalizer;
    }

    public CompletenessReport findMissingFormats(String categoryKey) {
        CompletenessReport report = new CompletenessReport();
        report.setCategoryKey(categoryKey);

        Map<String, CompletenessRecord> byIdentity = new LinkedHashMap<>();
        for (FormatKind kind : FormatKind.values()) {
            for (Path file : directoryScanService.listFormatDirectory(categoryKey, kind, false)) {
                String stem = IdentityNormalizer.stemOf(file.getFileName().toString());
                String identity = identityNormalizer.normalizeFilename(stem);
                CompletenessRecord record = byIdentity.get(identity);
                if (record == null) {
                    record = new CompletenessRecord();
                    record.setIdentity(identity);
                    record.setDisplayName(stem);
                    byIdentity.put(identity, record);
                }
                // Last file wins the slot; the replaced one is kept as a diagnostic.
                String previous = record.getPaths().put(kind, file.toString());
                if (previous != null) {
                    report.getCollisions().add(new IdentityCollision(categoryKey, identity, kind, file.toString(), previous));
                }
            }
        }

        for (CompletenessRecord record : byIdentity.values()) {
            for (FormatKind kind : FormatKind.values()) {
                if (!record.getPaths().containsKey(kind)) {
                    report.missing(kind).add(record.getDisplayName());
                }
            }
            if (record.isComplete()) {
                report.getComplete().add(record.getDisplayName());
            }
            report.getRecords().add(record);
        }

        log.info("COMPLETENESS_FINISH category={} identities={} complete={} missingCompressed={} "
                        + "missingLossless={} missingVideo={} collisions={}",
                categoryKey, byIdentity.size(), report.getComplete().size(),
                report.getMissingCompressedAudio().size(), report.getMissingLosslessAudio().size(),
                report.getMissingVideo().size(), report.getCollisions().size());
        return report;
    }
}
