package com.familyconnections.domain.normalize;

import com.familyconnections.domain.exception.MalformedRecordException;
import com.familyconnections.domain.model.AddressRecord;
import com.familyconnections.domain.model.AppointmentDate;
import com.familyconnections.domain.model.NormalizedOfficer;
import com.familyconnections.domain.model.NormalizedRole;
import com.familyconnections.domain.model.OfficerRecord;
import com.familyconnections.domain.model.PartialDate;
import com.familyconnections.domain.model.RoleRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw officer records before any detector runs.
 *
 * <p>Only a missing or blank {@code fullName} is fatal. Every other field
 * that cannot be parsed is stored as absent, which silently disables the
 * signals that need it.
 *
 * <p>Thread-safe: holds only immutable formatters.
 *
 * @author Platform Team
 * @since 1.0.0
 */
@Slf4j
public class OfficerRecordNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COMMA_SPACING = Pattern.compile("\\s*,\\s*");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final int COMPANY_NUMBER_LENGTH = 8;

    private static final Set<String> HONORIFICS = Set.of(
        "MR", "MRS", "MS", "MISS", "DR", "SIR", "DAME", "LORD", "LADY", "PROF"
    );

    private static final List<DateTimeFormatter> FULL_DATE_FORMATS = List.of(
        strict("uuuu-MM-dd"),
        strict("dd/MM/uuuu")
    );

    private static final List<DateTimeFormatter> YEAR_MONTH_FORMATS = List.of(
        strict("uuuu-MM"),
        strict("MM/uuuu"),
        strict("MMMM uuuu"),
        strict("MMM uuuu")
    );

    /**
     * Normalize one record.
     *
     * @param record raw record from an ingestion adapter
     * @return canonical record
     * @throws MalformedRecordException if the record or its full name is missing
     */
    public NormalizedOfficer normalize(OfficerRecord record) {
        if (record == null) {
            throw new MalformedRecordException("Officer record is missing", null);
        }
        if (record.getFullName() == null || record.getFullName().isBlank()) {
            throw new MalformedRecordException("Officer record has no full name", record.getOfficerId());
        }

        String displayName = collapse(record.getFullName());
        String surnameDisplay = resolveSurname(record.getSurname(), displayName);

        NormalizedOfficer.NormalizedOfficerBuilder builder = NormalizedOfficer.builder()
            .officerId(record.getOfficerId())
            .displayName(displayName)
            .surnameDisplay(surnameDisplay)
            .surname(surnameDisplay.toUpperCase(Locale.ROOT))
            .dateOfBirth(parsePartialDate(record.getDateOfBirth()).orElse(null))
            .companyName(blankToNull(record.getCompanyName()));

        for (String middleName : record.getMiddleNames()) {
            if (middleName == null || middleName.isBlank()) {
                continue;
            }
            String display = collapse(middleName);
            builder.middleName(display.toUpperCase(Locale.ROOT));
            builder.middleNameDisplay(display);
        }

        for (RoleRecord role : record.getRoles()) {
            if (role != null) {
                builder.role(normalizeRole(role));
            }
        }

        applyAddress(builder, record.getAddress());

        NormalizedOfficer officer = builder.build();
        if (log.isDebugEnabled()) {
            log.debug("Normalized officer {}: surname={}, dob={}, roles={}, address={}, coordinates={}",
                officer.label(), officer.getSurname(), officer.getDateOfBirth(),
                officer.getRoles().size(), officer.getAddressKey() != null, officer.hasCoordinates());
        }
        return officer;
    }

    /**
     * Parse a date of birth given to day or month precision. Year-only and
     * unparseable values yield empty.
     */
    public Optional<PartialDate> parsePartialDate(String raw) {
        String value = blankToNull(raw);
        if (value == null) {
            return Optional.empty();
        }
        Optional<LocalDate> full = parseFullDate(value);
        if (full.isPresent()) {
            return full.map(PartialDate::of);
        }
        for (DateTimeFormatter format : YEAR_MONTH_FORMATS) {
            try {
                return Optional.of(PartialDate.of(YearMonth.parse(value, format)));
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", value, format);
            }
        }
        log.debug("Unparseable partial date '{}', treating as absent", value);
        return Optional.empty();
    }

    /**
     * Parse a date given to day precision; anything coarser yields empty.
     */
    public Optional<LocalDate> parseFullDate(String raw) {
        String value = blankToNull(raw);
        if (value == null) {
            return Optional.empty();
        }
        for (DateTimeFormatter format : FULL_DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(value, format));
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", value, format);
            }
        }
        return Optional.empty();
    }

    /**
     * Canonical company number: trimmed, upper-cased, inner spaces removed and
     * purely numeric numbers left-padded to eight digits.
     */
    public static String normalizeCompanyNumber(String raw) {
        if (raw == null) {
            return "";
        }
        String number = WHITESPACE.matcher(raw).replaceAll("").toUpperCase(Locale.ROOT);
        if (DIGITS.matcher(number).matches() && number.length() < COMPANY_NUMBER_LENGTH) {
            number = "0".repeat(COMPANY_NUMBER_LENGTH - number.length()) + number;
        }
        return number;
    }

    /**
     * Comparison key for an address: case and whitespace insensitive.
     */
    public static String normalizeAddress(String raw) {
        String value = blankToNull(raw);
        if (value == null) {
            return null;
        }
        String key = COMMA_SPACING.matcher(collapse(value)).replaceAll(", ");
        return key.toUpperCase(Locale.ROOT);
    }

    private NormalizedRole normalizeRole(RoleRecord role) {
        return NormalizedRole.builder()
            .companyNumber(normalizeCompanyNumber(role.getCompanyNumber()))
            .companyName(blankToNull(role.getCompanyName()))
            .roleType(role.getRoleType() == null ? "" : collapse(role.getRoleType()).toLowerCase(Locale.ROOT))
            .appointment(resolveAppointment(role))
            .resignedOn(parseFullDate(role.getResignedOn()).orElse(null))
            .build();
    }

    private AppointmentDate resolveAppointment(RoleRecord role) {
        Optional<LocalDate> appointedOn = parseFullDate(role.getAppointedOn());
        if (appointedOn.isPresent()) {
            return AppointmentDate.exact(appointedOn.get());
        }
        return parseFullDate(role.getAppointedBefore())
            .map(AppointmentDate::notLaterThan)
            .orElse(AppointmentDate.unknown());
    }

    private void applyAddress(NormalizedOfficer.NormalizedOfficerBuilder builder, AddressRecord address) {
        if (address == null) {
            return;
        }
        builder.addressKey(normalizeAddress(address.getFullAddress()));
        if (address.hasCoordinates() && validCoordinates(address.getLatitude(), address.getLongitude())) {
            builder.latitude(address.getLatitude());
            builder.longitude(address.getLongitude());
        } else if (address.hasCoordinates()) {
            log.debug("Discarding out-of-range coordinates {}, {}", address.getLatitude(), address.getLongitude());
        }
    }

    private static boolean validCoordinates(double latitude, double longitude) {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
            && Math.abs(latitude) <= 90.0 && Math.abs(longitude) <= 180.0;
    }

    /**
     * Explicit surname wins; otherwise the part before a comma in registry
     * form, otherwise the last token that is not an honorific.
     */
    private static String resolveSurname(String explicit, String displayName) {
        String surname = blankToNull(explicit);
        if (surname != null) {
            return collapse(surname);
        }
        int comma = displayName.indexOf(',');
        if (comma > 0) {
            return collapse(displayName.substring(0, comma));
        }
        List<String> tokens = new ArrayList<>(Arrays.asList(displayName.split(" ")));
        tokens.removeIf(t -> HONORIFICS.contains(t.replace(".", "").toUpperCase(Locale.ROOT)));
        return tokens.isEmpty() ? "" : tokens.get(tokens.size() - 1);
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
