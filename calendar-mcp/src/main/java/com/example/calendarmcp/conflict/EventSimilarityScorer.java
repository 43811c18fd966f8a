package com.example.calendarmcp.conflict;

import com.example.calendarmcp.model.EventRecord;
import com.example.calendarmcp.model.TimeSpec;
import com.example.calendarmcp.time.DatetimeNormalizer;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

// First matching rule decides the score.
@Component
public class EventSimilarityScorer {
    public static final double DEFAULT_THRESHOLD = 0.7;

    static final double KIND_MISMATCH = 0.2;
    static final double EXACT_TITLE_OVERLAP = 0.95;
    static final double SIMILAR_TITLE_OVERLAP = 0.7;
    static final double EXACT_TITLE_SAME_DAY = 0.6;
    static final double EXACT_TITLE_OTHER_DAY = 0.4;
    static final double SIMILAR_TITLE = 0.3;
    static final double UNRELATED = 0.1;

    private static final int SIGNIFICANT_WORD_LENGTH = 3;
    private static final double SHARED_WORD_RATIO = 0.5;

    private final OverlapAnalyzer overlapAnalyzer;

    public EventSimilarityScorer(OverlapAnalyzer overlapAnalyzer) {
        this.overlapAnalyzer = overlapAnalyzer;
    }

    public double score(EventRecord first, EventRecord second) {
        if (first.isAllDay() != second.isAllDay()) {
            return KIND_MISMATCH;
        }

        TitleMatch title = matchTitles(first.getSummary(), second.getSummary());
        boolean overlap = overlapAnalyzer.overlaps(first, second);

        if (title == TitleMatch.EXACT && overlap) {
            return EXACT_TITLE_OVERLAP;
        }
        if (title != TitleMatch.NONE && overlap) {
            return SIMILAR_TITLE_OVERLAP;
        }
        if (title == TitleMatch.EXACT) {
            return onSameDay(first, second) ? EXACT_TITLE_SAME_DAY : EXACT_TITLE_OTHER_DAY;
        }
        if (title == TitleMatch.SIMILAR) {
            return SIMILAR_TITLE;
        }
        return UNRELATED;
    }

    public boolean isDuplicate(EventRecord first, EventRecord second) {
        return isDuplicate(first, second, DEFAULT_THRESHOLD);
    }

    public boolean isDuplicate(EventRecord first, EventRecord second, double threshold) {
        return score(first, second) >= threshold;
    }

    TitleMatch matchTitles(String firstTitle, String secondTitle) {
        if (firstTitle == null || secondTitle == null) {
            return TitleMatch.NONE;
        }
        String a = firstTitle.toLowerCase(Locale.ROOT).trim();
        String b = secondTitle.toLowerCase(Locale.ROOT).trim();
        if (a.isEmpty() || b.isEmpty()) {
            return TitleMatch.NONE;
        }
        if (a.equals(b)) {
            return TitleMatch.EXACT;
        }
        if (a.contains(b) || b.contains(a)) {
            return TitleMatch.SIMILAR;
        }

        List<String> wordsA = significantWords(a);
        List<String> wordsB = significantWords(b);
        if (wordsA.isEmpty() || wordsB.isEmpty()) {
            return TitleMatch.NONE;
        }
        long shared = wordsA.stream().filter(wordsB::contains).count();
        double ratio = (double) shared / Math.min(wordsA.size(), wordsB.size());
        return ratio >= SHARED_WORD_RATIO ? TitleMatch.SIMILAR : TitleMatch.NONE;
    }

    private List<String> significantWords(String title) {
        return Arrays.stream(title.split("\\s+"))
                .filter(word -> word.length() > SIGNIFICANT_WORD_LENGTH)
                .toList();
    }

    private boolean onSameDay(EventRecord first, EventRecord second) {
        if (first.isAllDay() && second.isAllDay()) {
            return Objects.equals(first.getStart().date(), second.getStart().date());
        }
        ZoneId zone = comparisonZone(first.getStart(), second.getStart());
        Optional<LocalDate> a = DatetimeNormalizer.resolveInstant(first.getStart())
                .map(instant -> instant.atZone(zone).toLocalDate());
        Optional<LocalDate> b = DatetimeNormalizer.resolveInstant(second.getStart())
                .map(instant -> instant.atZone(zone).toLocalDate());
        return a.isPresent() && a.equals(b);
    }

    private ZoneId comparisonZone(TimeSpec first, TimeSpec second) {
        for (TimeSpec spec : new TimeSpec[]{first, second}) {
            if (spec != null && spec.timeZone() != null && !spec.timeZone().isBlank()) {
                try {
                    return ZoneId.of(spec.timeZone());
                } catch (DateTimeException ex) {
                    return ZoneOffset.UTC;
                }
            }
        }
        return ZoneOffset.UTC;
    }

    enum TitleMatch {
        EXACT,
        SIMILAR,
        NONE
    }
}
