package com.jamcycle.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jamcycle.model.ArchivedCycle;
import com.jamcycle.model.CompetitionCycle;
import com.jamcycle.model.CompetitionPhase;
import com.jamcycle.model.FaceOff;
import com.jamcycle.model.GuildState;
import com.jamcycle.model.PendingAnnouncement;
import com.jamcycle.model.Team;
import com.jamcycle.model.TenantConfig;
import com.jamcycle.model.VoteTally;
import com.jamcycle.model.WinnerRecord;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts between the flat string fields of the state store and {@link GuildState}.
 * <p>
 * Settings are parsed leniently and fall back to their defaults. Structured fields that do not
 * parse are reported as corrupt rather than silently dropped.
 */
public final class GuildStateCodec {

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on");
    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no", "off");

    private static final TypeReference<Map<String, Team>> SUBMISSIONS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, VoteTally>> VOTING_RESULTS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Map<String, String>>> INDIVIDUAL_VOTES_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, WinnerRecord>> WINNERS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, ArchivedCycle>> ARCHIVE_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {
    };

    private GuildStateCodec() {
    }

    public static ObjectMapper objectMapper() {
        return OBJECT_MAPPER;
    }

    public static GuildState decode(String tenantId, Map<String, String> fields) {
        Map<String, String> source = fields == null ? Map.of() : fields;

        CompetitionCycle cycle = new CompetitionCycle(
                blankToNull(source.get(GuildFields.CYCLE_KEY)),
                blankToNull(source.get(GuildFields.CURRENT_THEME)),
                CompetitionPhase.fromWire(source.get(GuildFields.CURRENT_PHASE)).orElse(CompetitionPhase.INACTIVE),
                parseBoolean(source.get(GuildFields.WEEK_CANCELLED), false),
                parseBoolean(source.get(GuildFields.WINNER_ANNOUNCED), false),
                blankToNull(source.get(GuildFields.LAST_ANNOUNCEMENT))
        );

        return new GuildState(
                tenantId,
                cycle,
                decodeConfig(source),
                parseBoolean(source.get(GuildFields.AUTO_ANNOUNCE), true),
                parseBoolean(source.get(GuildFields.THEME_GENERATION_DONE), false),
                blankToNull(source.get(GuildFields.NEXT_WEEK_THEME)),
                readJson(source, GuildFields.SUBMISSIONS, SUBMISSIONS_TYPE, Map.of()),
                readJson(source, GuildFields.VOTING_RESULTS, VOTING_RESULTS_TYPE, Map.of()),
                readJson(source, GuildFields.INDIVIDUAL_VOTES, INDIVIDUAL_VOTES_TYPE, Map.of()),
                decodeFaceOff(source),
                readJson(source, GuildFields.WEEKLY_WINNERS, WINNERS_TYPE, Map.of()),
                readJson(source, GuildFields.CYCLE_ARCHIVE, ARCHIVE_TYPE, Map.of()),
                readJson(source, GuildFields.PENDING_ANNOUNCEMENT, new TypeReference<PendingAnnouncement>() {
                }, null),
                parseInstant(source.get(GuildFields.RESTART_NOT_BEFORE))
        );
    }

    public static TenantConfig decodeConfig(Map<String, String> source) {
        return new TenantConfig(
                parseBoolean(source.get(GuildFields.BIWEEKLY_MODE), false),
                parseInt(source.get(GuildFields.MIN_TEAMS_REQUIRED), TenantConfig.DEFAULT_MIN_TEAMS_REQUIRED),
                parseBoolean(source.get(GuildFields.SAFE_MODE_ENABLED), true),
                parseBoolean(source.get(GuildFields.REQUIRE_CONFIRMATION), false),
                parseInt(source.get(GuildFields.CONFIRMATION_TIMEOUT_SECONDS),
                        TenantConfig.DEFAULT_CONFIRMATION_TIMEOUT_SECONDS)
        );
    }

    public static String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize guild state field", ex);
        }
    }

    public static String writeInstant(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    /**
     * Parses a boolean written by this codec or typed by an operator ("yes", "1", ...).
     *
     * @return the parsed value, or {@code fallback} when absent or unrecognised
     */
    public static boolean parseBoolean(String value, boolean fallback) {
        Boolean parsed = parseBooleanOrNull(value);
        return parsed == null ? fallback : parsed;
    }

    public static Boolean parseBooleanOrNull(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return Boolean.FALSE;
        }
        return null;
    }

    public static int parseInt(String value, int fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static FaceOff decodeFaceOff(Map<String, String> source) {
        boolean active = parseBoolean(source.get(GuildFields.FACE_OFF_ACTIVE), false);
        Instant deadline = parseInstant(source.get(GuildFields.FACE_OFF_DEADLINE));
        if (!active || deadline == null) {
            return FaceOff.inactive();
        }
        return new FaceOff(
                true,
                readJson(source, GuildFields.FACE_OFF_TEAMS, STRING_LIST_TYPE, List.of()),
                deadline,
                readJson(source, GuildFields.FACE_OFF_RESULTS, new TypeReference<VoteTally>() {
                }, VoteTally.empty())
        );
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static <T> T readJson(Map<String, String> source, String field, TypeReference<T> type, T fallback) {
        String raw = source.get(field);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            T value = OBJECT_MAPPER.readValue(raw, type);
            return value == null ? fallback : value;
        } catch (JsonProcessingException ex) {
            throw new GuildStateStoreException("Corrupt guild state field: " + field, ex);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
