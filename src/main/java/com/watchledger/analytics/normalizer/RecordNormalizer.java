package com.watchledger.analytics.normalizer;

import com.watchledger.domain.WatchRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

/**
 * Turns raw records into arithmetic-safe values once per record. Absent amounts become zero; absent or
 * unparseable dates become null so dependent figures are "not computable" instead of defaulting to an epoch.
 * Never throws for missing or malformed optional fields.
 */
@Component
@Slf4j
public class RecordNormalizer {

    private static final int ISO_DATE_LENGTH = 10;

    public NormalizedWatch normalize(WatchRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        return new NormalizedWatch(
                record.getId(),
                record.getBrand(),
                record.getModel(),
                record.getReferenceNumber(),
                parseDate(record.getInDate(), record.getId(), "inDate"),
                amount(record.getPurchasePrice()),
                record.getPurchasePrice() != null,
                amount(record.getAccessoriesCost()),
                parseDate(record.getDateSold(), record.getId(), "dateSold"),
                amount(record.getPriceSold()),
                record.getPriceSold() != null,
                amount(record.getFees()),
                amount(record.getShipping()),
                amount(record.getTaxes()),
                record.getSellerContactId(),
                record.getBuyerContactId()
        );
    }

    public List<NormalizedWatch> normalizeAll(List<WatchRecord> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        return records.stream()
                .filter(Objects::nonNull)
                .map(this::normalize)
                .toList();
    }

    public static BigDecimal amount(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    /**
     * Parses YYYY-MM-DD; a date-time such as 2024-03-01T10:00:00Z is cut to its date part.
     * Returns null for blank or unparseable input.
     */
    public static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.strip();
        if (value.length() > ISO_DATE_LENGTH
                && (value.charAt(ISO_DATE_LENGTH) == 'T' || value.charAt(ISO_DATE_LENGTH) == ' ')) {
            value = value.substring(0, ISO_DATE_LENGTH);
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private LocalDate parseDate(String raw, String recordId, String field) {
        LocalDate parsed = parseDate(raw);
        if (parsed == null && raw != null && !raw.isBlank()) {
            log.debug("Dropping unparseable {} '{}' on record {}", field, raw, recordId);
        }
        return parsed;
    }
}
