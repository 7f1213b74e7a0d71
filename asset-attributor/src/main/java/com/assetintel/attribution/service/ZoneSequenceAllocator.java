package com.assetintel.attribution.service;

import com.assetintel.attribution.config.AttributorProperties;
import com.assetintel.attribution.model.AssetCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Map-page facility ids: sanitized zone code + zero padded sequence number
 * + optional category suffix, e.g. zone "14-14" → 1414071, 1414072, ...
 *
 * The starting point is the highest number already used by ids of the same
 * category in the zone. An id belongs to the zone when it starts with the
 * zone code, or the code follows a non-digit prefix such as "SD". Gaps left
 * by manual edits are kept.
 * Each category keeps its own counter per zone.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ZoneSequenceAllocator {

    private final AttributorProperties properties;

    public String sanitize(String zoneCode) {
        if (zoneCode == null) {
            throw new IllegalArgumentException("Zone code is null");
        }
        String separators = properties.getSequence().getSeparators();
        StringBuilder sanitized = new StringBuilder(zoneCode.length());
        for (char c : zoneCode.trim().toCharArray()) {
            if (separators.indexOf(c) < 0) sanitized.append(c);
        }
        if (sanitized.length() == 0) {
            throw new IllegalArgumentException("Zone code '" + zoneCode + "' is empty after sanitizing");
        }
        return sanitized.toString();
    }

    public String suffixFor(AssetCategory category) {
        return properties.getSequence().getCategorySuffixes().getOrDefault(category, "");
    }

    /**
     * Current allocation state for a zone, derived from the ids already in use.
     */
    public ZoneSequence open(String zoneCode, AssetCategory category, Collection<String> existingIdsInZone) {
        String code = sanitize(zoneCode);
        String suffix = suffixFor(category);
        int width = properties.getSequence().getWidth();

        int max = 0;
        for (String id : existingIdsInZone) {
            int number = parseSequenceNumber(id, code, suffix, width);
            if (number > max) max = number;
        }
        log.debug("Zone {} ({}) current maximum: {}", code, category, max);
        return new ZoneSequence(code, suffix, width, max);
    }

    /**
     * Next {@code count} ids for the zone, in assignment order. Either all of
     * them fit in the sequence width or none are returned.
     */
    public List<String> allocate(String zoneCode, AssetCategory category, Collection<String> existingIdsInZone, int count) {
        ZoneSequence sequence = open(zoneCode, category, existingIdsInZone);
        List<String> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            sequence = sequence.advance();
            ids.add(sequence.currentId());
        }
        return ids;
    }

    /**
     * Trailing sequence number of an existing id, or 0 if the id does not
     * belong to this zone or does not end in {@code width} digits.
     */
    static int parseSequenceNumber(String id, String zoneCode, String suffix, int width) {
        if (id == null) return 0;

        String body = id.trim();
        if (!suffix.isEmpty()) {
            if (!body.endsWith(suffix)) return 0;
            body = body.substring(0, body.length() - suffix.length());
        }
        // zone code immediately followed by the numeric tail
        int tailStart = body.length() - width;
        int codeStart = tailStart - zoneCode.length();
        if (codeStart < 0) return 0;
        if (!body.startsWith(zoneCode, codeStart)) return 0;
        // 1414065 is zone 1414, not zone 414
        if (codeStart > 0 && Character.isDigit(body.charAt(codeStart - 1))) return 0;

        String tail = body.substring(tailStart);
        for (int i = 0; i < tail.length(); i++) {
            if (!Character.isDigit(tail.charAt(i))) return 0;
        }
        return Integer.parseInt(tail);
    }
}
