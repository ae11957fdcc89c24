package com.delta.opportunities.pipeline.ingest;

import com.delta.opportunities.pipeline.model.OpportunityFields;
import com.delta.opportunities.pipeline.util.HashUtils;
import com.delta.opportunities.pipeline.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Content fingerprint of a canonical opportunity: normalized title and organization plus an
 * anchor. The anchor is the canonical URL when there is one, otherwise a min-hash style
 * signature of the description so that the same text reposted without a link still collides.
 */
@Component
public class FingerprintCalculator {
    static final int SHINGLE_SIZE = 3;
    static final int SIGNATURE_SIZE = 8;

    public String fingerprint(OpportunityFields fields) {
        String anchor = fields.canonicalUrl() != null
            ? "url:" + fields.canonicalUrl()
            : "sig:" + descriptionSignature(fields.description());
        String material = TextNormalizer.normalize(fields.title())
            + "|" + TextNormalizer.normalize(fields.organization())
            + "|" + anchor;
        return HashUtils.sha256Hex(material);
    }

    /**
     * Bottom-k hashes of the description's word shingles, joined in ascending order.
     */
    public String descriptionSignature(String description) {
        List<String> shingles = TextNormalizer.shingles(description, SHINGLE_SIZE);
        if (shingles.isEmpty()) {
            return "";
        }
        TreeSet<Long> hashes = new TreeSet<>();
        for (String shingle : shingles) {
            hashes.add(HashUtils.sha256Long(shingle));
        }
        return hashes.stream()
            .limit(SIGNATURE_SIZE)
            .map(Long::toHexString)
            .collect(Collectors.joining(","));
    }
}
