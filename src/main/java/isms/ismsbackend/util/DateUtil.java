package isms.ismsbackend.util;

import isms.ismsbackend.exception.DocumentValidationException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

public final class DateUtil {

    private static final int DATE_ONLY_LENGTH = 10;

    private DateUtil() {
    }

    /**
     * 요청 문자열을 UTC 기준 LocalDateTime으로 변환
     * - null 또는 빈 문자열: null (필드 비우기)
     * - "yyyy-MM-dd" (10자): 해당 일자 00:00 UTC
     * - 오프셋 포함 ISO 시각: UTC로 환산
     * - 오프셋 없는 ISO 시각: UTC로 간주
     * @param fieldName 오류 메시지에 쓸 필드명
     */
    public static LocalDateTime parseTimestamp(String value, String fieldName) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }

        try {
            if (trimmed.length() == DATE_ONLY_LENGTH) {
                return LocalDate.parse(trimmed).atStartOfDay();
            }
            try {
                return OffsetDateTime.parse(trimmed)
                        .withOffsetSameInstant(ZoneOffset.UTC)
                        .toLocalDateTime();
            } catch (DateTimeParseException ignored) {
                return LocalDateTime.parse(trimmed);
            }
        } catch (DateTimeParseException e) {
            throw new DocumentValidationException(fieldName + " is not a valid date: " + value);
        }
    }
}
