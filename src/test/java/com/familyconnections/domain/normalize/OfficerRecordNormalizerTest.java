package com.familyconnections.domain.normalize;

import com.familyconnections.domain.exception.MalformedRecordException;
import com.familyconnections.domain.model.AddressRecord;
import com.familyconnections.domain.model.AppointmentDate;
import com.familyconnections.domain.model.NormalizedOfficer;
import com.familyconnections.domain.model.NormalizedRole;
import com.familyconnections.domain.model.OfficerRecord;
import com.familyconnections.domain.model.PartialDate;
import com.familyconnections.domain.model.RoleRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class OfficerRecordNormalizerTest {

    private final OfficerRecordNormalizer normalizer = new OfficerRecordNormalizer();

    @Test
    void missingFullNameIsMalformed() {
        OfficerRecord record = OfficerRecord.builder().officerId("X-9").surname("Smith").build();

        MalformedRecordException e = assertThrows(MalformedRecordException.class,
            () -> normalizer.normalize(record));
        assertEquals("X-9", e.getOfficerId());
        assertTrue(e.getMessage().contains("X-9"));
    }

    @Test
    void blankFullNameIsMalformed() {
        OfficerRecord record = OfficerRecord.builder().fullName("   ").build();

        assertThrows(MalformedRecordException.class, () -> normalizer.normalize(record));
    }

    @Test
    void nullRecordIsMalformed() {
        assertThrows(MalformedRecordException.class, () -> normalizer.normalize(null));
    }

    @Test
    void surnameTakenFromLastToken() {
        NormalizedOfficer officer = normalizer.normalize(OfficerRecord.builder()
            .fullName("  William   John  Gregory ")
            .build());

        assertEquals("William John Gregory", officer.getDisplayName());
        assertEquals("Gregory", officer.getSurnameDisplay());
        assertEquals("GREGORY", officer.getSurname());
    }

    @Test
    void surnameTakenFromRegistryForm() {
        NormalizedOfficer officer = normalizer.normalize(OfficerRecord.builder()
            .fullName("SMITH-JONES, Anna Marie")
            .build());

        assertEquals("SMITH-JONES", officer.getSurname());
    }

    @Test
    void honorificsIgnored() {
        NormalizedOfficer officer = normalizer.normalize(OfficerRecord.builder()
            .fullName("Jane Doe Dr.")
            .build());

        assertEquals("Doe", officer.getSurnameDisplay());
    }

    @Test
    void explicitSurnameWins() {
        NormalizedOfficer officer = normalizer.normalize(OfficerRecord.builder()
            .fullName("Maria de la Cruz")
            .surname("de la Cruz")
            .build());

        assertEquals("DE LA CRUZ", officer.getSurname());
        assertEquals("de la Cruz", officer.getSurnameDisplay());
    }

    @Test
    void middleNamesKeyedInUpperCaseAndBlanksSkipped() {
        NormalizedOfficer officer = normalizer.normalize(OfficerRecord.builder()
            .fullName("William John Gregory")
            .middleName(" John ")
            .middleName("")
            .build());

        assertEquals(List.of("JOHN"), officer.getMiddleNames());
        assertEquals(List.of("John"), officer.getMiddleNamesDisplay());
    }

    @ParameterizedTest
    @CsvSource({
        "1958-03-15, 1958-03-15",
        "15/03/1958, 1958-03-15",
        "1958-03, 1958-03",
        "03/1958, 1958-03",
        "March 1958, 1958-03",
        "mar 1958, 1958-03"
    })
    void datesOfBirthParsedAtTheirPrecision(String raw, String expected) {
        PartialDate date = normalizer.parsePartialDate(raw).orElseThrow();

        assertEquals(expected, date.toString());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1958", "1958-02-30", "not a date", "  "})
    void unusableDatesOfBirthAreAbsent(String raw) {
        assertTrue(normalizer.parsePartialDate(raw).isEmpty());

        NormalizedOfficer officer = normalizer.normalize(OfficerRecord.builder()
            .fullName("Ann Other")
            .dateOfBirth(raw)
            .build());
        assertNull(officer.getDateOfBirth());
    }

    @Test
    void monthOnlyDateHasMonthPrecision() {
        PartialDate date = normalizer.parsePartialDate("1958-03").orElseThrow();

        assertEquals(PartialDate.Precision.MONTH, date.getPrecision());
        assertEquals(YearMonth.of(1958, 3), date.getYearMonth());
    }

    @Test
    void companyNumbersCanonicalized() {
        assertEquals("01329163", OfficerRecordNormalizer.normalizeCompanyNumber("1329163"));
        assertEquals("SC123456", OfficerRecordNormalizer.normalizeCompanyNumber(" sc 123456 "));
        assertEquals("123456789", OfficerRecordNormalizer.normalizeCompanyNumber("123456789"));
        assertEquals("", OfficerRecordNormalizer.normalizeCompanyNumber(null));
    }

    @Test
    void addressKeyIgnoresCaseAndSpacing() {
        assertEquals("1 HIGH STREET, LONDON",
            OfficerRecordNormalizer.normalizeAddress("1  High Street ,London "));
        assertEquals(OfficerRecordNormalizer.normalizeAddress("1 high street, london"),
            OfficerRecordNormalizer.normalizeAddress("1 HIGH STREET , LONDON"));
        assertNull(OfficerRecordNormalizer.normalizeAddress(" "));
    }

    @Test
    void rolesNormalized() {
        NormalizedOfficer officer = normalizer.normalize(OfficerRecord.builder()
            .fullName("Ann Other")
            .role(RoleRecord.builder()
                .companyNumber("1329163")
                .roleType(" Director ")
                .appointedOn("1977-06-01")
                .appointedBefore("1980-01-01")
                .resignedOn("2010-07-29")
                .build())
            .role(RoleRecord.builder()
                .companyNumber("555")
                .roleType("SECRETARY")
                .appointedBefore("1992-04-06")
                .resignedOn("sometime")
                .build())
            .role(null)
            .build());

        assertThat(officer.getRoles()).hasSize(2);

        NormalizedRole first = officer.getRoles().get(0);
        assertEquals("01329163", first.getCompanyNumber());
        assertEquals("director", first.getRoleType());
        assertEquals(AppointmentDate.exact(LocalDate.of(1977, 6, 1)), first.getAppointment());
        assertEquals(LocalDate.of(2010, 7, 29), first.getResignedOn());

        NormalizedRole second = officer.getRoles().get(1);
        assertEquals(AppointmentDate.notLaterThan(LocalDate.of(1992, 4, 6)), second.getAppointment());
        assertTrue(second.isActive());
    }

    @Test
    void missingAppointmentIsUnknown() {
        NormalizedOfficer officer = normalizer.normalize(OfficerRecord.builder()
            .fullName("Ann Other")
            .role(RoleRecord.builder().companyNumber("555").build())
            .build());

        NormalizedRole role = officer.getRoles().get(0);
        assertEquals(AppointmentDate.unknown(), role.getAppointment());
        assertEquals("", role.getRoleType());
    }

    @Test
    void outOfRangeCoordinatesDiscarded() {
        NormalizedOfficer officer = normalizer.normalize(OfficerRecord.builder()
            .fullName("Ann Other")
            .address(AddressRecord.builder()
                .fullAddress("1 High Street")
                .latitude(123.0)
                .longitude(0.5)
                .build())
            .build());

        assertEquals("1 HIGH STREET", officer.getAddressKey());
        assertFalse(officer.hasCoordinates());
    }

    @Test
    void labelPrefersOfficerId() {
        assertEquals("ID-1", normalizer.normalize(OfficerRecord.builder()
            .officerId("ID-1").fullName("Ann Other").build()).label());
        assertEquals("Ann Other", normalizer.normalize(OfficerRecord.builder()
            .fullName("Ann Other").build()).label());
    }
}
