package io.github.calltable.generator;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.calltable.files.InputFormat;
import io.github.calltable.schema.CallSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Produces synthetic call records in the shape the pipeline ingests.
 *
 * <p>Output is reproducible for a given seed and clock. Records carry the nested
 * {@code questions} and {@code themes} arrays the pipeline either ignores or derives
 * from.</p>
 */
public class CallRecordGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(CallRecordGenerator.class);

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();

    static final List<String> CALL_TYPES = ImmutableList.of(
            "Inbound", "Outbound", "Follow-up", "Escalation", "Callback", "Voicemail");

    static final List<String> CALL_OUTCOMES = ImmutableList.of(
            "Resolved", "Escalated", "Dropped", "Transferred");

    static final List<String> EMOTIONS = ImmutableList.of(
            "Neutral", "Confused", "Frustrated", "Angry", "Anxious", "Distressed", "Relieved", "Grateful");

    static final List<String> CALL_REASONS = ImmutableList.of(
            "Eligibility or Coverage Inquiry",
            "Benefits Access or Card Issues",
            "Claims or Payments",
            "Prior Authorization or Referrals",
            "Provider Enrollment or Credentialing",
            "Member Information Update",
            "Program Education or Guidance",
            "Technical Support or Portal Issues",
            "Complaint or Grievance",
            "General Inquiry or Other",
            "Pharmacy or Prescription Issue",
            "Service Authorization Status",
            "Appeal or Denial Follow-up",
            "Appointment Scheduling or Transportation",
            "Document Submission or Verification");

    private static final List<String> WORD_POOL = ImmutableList.of(
            "benefits", "card", "stopped", "not", "working", "provider", "enrollment", "update",
            "email", "address", "portal", "issue", "claim", "payment", "denial", "appeal",
            "authorization", "referral", "coverage", "eligibility", "revalidation", "status",
            "Medicaid", "contact", "transportation", "appointment", "document", "submission");

    private static final List<String> FIRST_NAMES = ImmutableList.of(
            "Maria", "James", "Aisha", "Chen", "Olivia", "Diego", "Priya", "Noah", "Fatima", "Liam",
            "Sofia", "Ethan", "Grace", "Mateo", "Hannah", "Omar");

    private static final List<String> LAST_NAMES = ImmutableList.of(
            "Garcia", "Smith", "Johnson", "Nguyen", "Patel", "Brown", "Kim", "Lopez", "Walker", "Young",
            "Rivera", "Clark", "Davis", "Hughes", "Okafor", "Martin");

    private static final List<String> VIDEO_EXTENSIONS = ImmutableList.of("mp4", "mov", "avi", "webm");

    private static final int MAX_RECORDED_DAYS_BACK = 180;

    private final Random random;
    private final Clock clock;
    private final Set<String> issuedCallIds = new HashSet<>();

    public CallRecordGenerator(long seed) {
        this(seed, Clock.systemUTC());
    }

    public CallRecordGenerator(long seed, Clock clock) {
        this.random = new Random(seed);
        this.clock = clock;
    }

    /**
     * Generates {@code count} records.
     */
    public List<Map<String, Object>> generate(int count) {
        Preconditions.checkArgument(count >= 0, "count must not be negative: %s", count);
        List<Map<String, Object>> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(nextRecord());
        }
        return records;
    }

    /**
     * Generates one record with every required field plus {@code questions} and {@code themes}.
     */
    public Map<String, Object> nextRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(CallSchema.CALL_ID, uniqueCallId());
        record.put(CallSchema.FILENAME, fileName());
        record.put(CallSchema.TIMESTAMP, timestamp());
        record.put(CallSchema.AGENT, pick(FIRST_NAMES) + " " + pick(LAST_NAMES).charAt(0) + ".");
        record.put(CallSchema.ACCOUNT_ID, accountId());
        record.put(CallSchema.TOTAL_CALL_TIME, BigDecimal.valueOf(0.5 + random.nextDouble() * 14.5)
                .setScale(2, RoundingMode.HALF_EVEN).doubleValue());
        record.put(CallSchema.PRIMARY_REASON, phrase(10, 15));
        record.put(CallSchema.CALL_TYPE, pick(CALL_TYPES));
        record.put(CallSchema.CALL_CATEGORY, pick(CALL_REASONS));
        record.put(CallSchema.CALL_OUTCOME, pick(CALL_OUTCOMES));
        record.put("questions", questions());
        record.put(CallSchema.THEMES, themes());
        record.put(CallSchema.SENTIMENT_SCORE, random.nextInt(11));
        record.put(CallSchema.FOOD_PROGRAM, random.nextBoolean());
        return record;
    }

    /**
     * Writes {@code count} generated records to {@code target}: one object per line for a
     * {@code .jsonl} target, a single JSON array otherwise. Parent directories are created.
     *
     * @return the number of records written
     */
    public int write(Path target, int count) throws IOException {
        List<Map<String, Object>> records = generate(count);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        boolean jsonLines = InputFormat.forPath(target).orElse(InputFormat.JSON) == InputFormat.JSON_LINES;
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            if (jsonLines) {
                for (Map<String, Object> record : records) {
                    OBJECT_MAPPER.writeValue(writer, record);
                    writer.write('\n');
                }
            } else {
                OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(writer, records);
            }
        }
        LOG.info("Saved {} records to {}", records.size(), target);
        return records.size();
    }

    private String uniqueCallId() {
        String id;
        do {
            id = String.valueOf(100_000_000_000L + (long) (random.nextDouble() * 900_000_000_000L));
        } while (!issuedCallIds.add(id));
        return id;
    }

    private String fileName() {
        return pick(WORD_POOL).toLowerCase(Locale.ROOT) + "_" + pick(WORD_POOL).toLowerCase(Locale.ROOT) + "." + pick(VIDEO_EXTENSIONS);
    }

    private String timestamp() {
        Duration back = Duration.ofDays(random.nextInt(MAX_RECORDED_DAYS_BACK + 1))
                .plusHours(random.nextInt(24))
                .plusMinutes(random.nextInt(60));
        Instant at = clock.instant().minus(back).truncatedTo(ChronoUnit.SECONDS);
        return DateTimeFormatter.ISO_INSTANT.format(at);
    }

    private String accountId() {
        StringBuilder sb = new StringBuilder("ACC-");
        for (int i = 0; i < 4; i++) {
            sb.append((char) ('0' + random.nextInt(10)));
        }
        sb.append('-');
        for (int i = 0; i < 2; i++) {
            sb.append((char) ('A' + random.nextInt(26)));
        }
        return sb.toString();
    }

    private List<Map<String, Object>> questions() {
        int k = 1 + random.nextInt(3);
        List<Map<String, Object>> items = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("question", String.join(" ", sample(5 + random.nextInt(3))));
            item.put("quote", phrase(6, 10));
            items.add(item);
        }
        return items;
    }

    private List<Map<String, Object>> themes() {
        int k = 1 + random.nextInt(3);
        List<Map<String, Object>> items = new ArrayList<>(k);
        Set<String> used = new HashSet<>();
        while (items.size() < k) {
            String theme = phrase(2, 5);
            if (used.add(theme)) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("theme", theme);
                item.put(CallSchema.EMOTION, pick(EMOTIONS));
                item.put("quote", phrase(6, 12));
                items.add(item);
            }
        }
        return items;
    }

    /**
     * Returns a capitalized phrase of distinct pool words.
     */
    private String phrase(int minWords, int maxWords) {
        String joined = String.join(" ", sample(minWords + random.nextInt(maxWords - minWords + 1)));
        return Character.toUpperCase(joined.charAt(0)) + joined.substring(1).toLowerCase(Locale.ROOT);
    }

    private List<String> sample(int n) {
        List<String> pool = new ArrayList<>(WORD_POOL);
        Collections.shuffle(pool, random);
        return pool.subList(0, Math.min(n, pool.size()));
    }

    private <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }
}
