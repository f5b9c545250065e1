package com.wpanther.greengoods.service;

import com.wpanther.greengoods.dto.ai.ParsedTask;
import com.wpanther.greengoods.dto.ai.ParsedWorkData;
import com.wpanther.greengoods.dto.ai.TaskType;
import com.wpanther.greengoods.exception.TranscriptionException;
import com.wpanther.greengoods.port.AiPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern based work extraction, used when no language model is wired in.
 * Recognizes tree planting, weed removal and a generic "planted N something".
 */
@Slf4j
@RequiredArgsConstructor
public class RegexWorkTextParser implements AiPort {

    private static final List<Pattern> TREE_PATTERNS = List.of(
            Pattern.compile("planted?\\s*(\\d+)\\s*trees?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+)\\s*trees?\\s*planted", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+)\\s*trees?", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> WEED_PATTERNS = List.of(
            Pattern.compile("(\\d+)\\s*(kg|lbs?|pounds?)?\\s*(?:of\\s*)?weeds?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("weeded?\\s*(\\d+)\\s*(kg|lbs?|pounds?)?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("removed?\\s*(\\d+)\\s*(kg|lbs?|pounds?)?\\s*(?:of\\s*)?weeds?", Pattern.CASE_INSENSITIVE));

    private static final Pattern GENERIC_PLANTING = Pattern.compile("planted?\\s*(\\d+)\\s*(\\w+)", Pattern.CASE_INSENSITIVE);

    private final Clock clock;

    @Override
    public String transcribe(byte[] audio, String mimeType) {
        throw new TranscriptionException("No speech-to-text model is configured");
    }

    @Override
    public ParsedWorkData parseWorkText(String text, String locale) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        List<ParsedTask> tasks = new ArrayList<>();

        Matcher trees = firstMatch(TREE_PATTERNS, lower);
        if (trees != null) {
            tasks.add(ParsedTask.builder()
                    .type(TaskType.PLANTING)
                    .species("tree")
                    .count(parseCount(trees.group(1)))
                    .build());
        }

        Matcher weeds = firstMatch(WEED_PATTERNS, lower);
        if (weeds != null) {
            tasks.add(ParsedTask.builder()
                    .type(TaskType.WEEDING)
                    .species("weed")
                    .amount(parseCount(weeds.group(1)))
                    .unit(normalizeUnit(weeds.group(2)))
                    .build());
        }

        Matcher planted = GENERIC_PLANTING.matcher(lower);
        if (planted.find() && tasks.stream().noneMatch(task -> task.getType() == TaskType.PLANTING)) {
            tasks.add(ParsedTask.builder()
                    .type(TaskType.PLANTING)
                    .species(planted.group(2))
                    .count(parseCount(planted.group(1)))
                    .build());
        }

        log.debug("Parsed {} task(s) from text", tasks.size());
        return ParsedWorkData.builder()
                .tasks(tasks)
                .notes(text)
                .date(LocalDate.now(clock).toString())
                .build();
    }

    @Override
    public boolean isModelLoaded() {
        return false;
    }

    private static Matcher firstMatch(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher;
            }
        }
        return null;
    }

    private static Integer parseCount(String digits) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            // More digits than an int holds
            return Integer.MAX_VALUE;
        }
    }

    static String normalizeUnit(String unit) {
        if (unit == null) {
            return "kg";
        }
        String lower = unit.toLowerCase(Locale.ROOT);
        if (lower.startsWith("lb") || lower.startsWith("pound")) {
            return "lbs";
        }
        return "kg";
    }
}
