package com.example.menuimport.service;

import com.example.menuimport.model.ImportMode;
import com.example.menuimport.model.MappingField;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Suggests a column mapping from CSV headers and checks a mapping against the mode's required
 * fields.
 */
@Component
public class ColumnMappingSuggester {

    private static final Pattern HEADER_SEPARATORS = Pattern.compile("[\\s_-]");
    private static final Set<String> BULK_HINTS = Set.of("strain name", "strain", "grower", "grow/brand");
    private static final Set<String> PREPACKAGED_HINTS = Set.of("product name", "price", "size", "weight");

    /**
     * Maps each field of the mode onto the first header matching one of its aliases. A header is
     * used for one field at most; fields earlier in the catalog win.
     *
     * @return csvColumn to field key, in header order of assignment
     */
    public Map<String, String> suggest(List<String> headers, ImportMode mode) {
        Map<String, String> suggestions = new LinkedHashMap<>();
        Set<String> assigned = new HashSet<>();
        for (MappingField field : MappingField.forMode(mode)) {
            for (String header : headers) {
                if (!assigned.contains(header) && matchesAny(header, field.aliases())) {
                    suggestions.put(header, field.key());
                    assigned.add(header);
                    break;
                }
            }
        }
        return suggestions;
    }

    public Optional<ImportMode> detectMode(List<String> headers) {
        boolean bulk = headers.stream().map(ColumnMappingSuggester::lower).anyMatch(BULK_HINTS::contains);
        boolean prepackaged = headers.stream().map(ColumnMappingSuggester::lower).anyMatch(PREPACKAGED_HINTS::contains);
        if (bulk && !prepackaged) {
            return Optional.of(ImportMode.BULK);
        }
        if (prepackaged && !bulk) {
            return Optional.of(ImportMode.PREPACKAGED);
        }
        return Optional.empty();
    }

    public List<String> missingRequiredFields(Map<String, String> columnMapping, ImportMode mode) {
        Collection<String> mapped = columnMapping == null ? List.of() : columnMapping.values();
        List<String> missing = new ArrayList<>();
        for (MappingField field : MappingField.forMode(mode)) {
            if (field.required() && !mapped.contains(field.key())) {
                missing.add(field.key());
            }
        }
        return missing;
    }

    static boolean matches(String header, String alias) {
        String normalizedHeader = lower(header);
        String normalizedAlias = lower(alias);
        if (normalizedHeader.isEmpty() || normalizedAlias.isEmpty()) {
            return false;
        }
        return normalizedHeader.equals(normalizedAlias)
                || normalizedHeader.contains(normalizedAlias)
                || normalizedAlias.contains(normalizedHeader)
                || strip(normalizedHeader).equals(strip(normalizedAlias));
    }

    private static boolean matchesAny(String header, List<String> aliases) {
        return aliases.stream().anyMatch(alias -> matches(header, alias));
    }

    private static String strip(String value) {
        return HEADER_SEPARATORS.matcher(value).replaceAll("");
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
