package com.fintech.recurringcharges.service.criteria;

import com.fintech.recurringcharges.entity.MatchType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Builds merchant matching rules from example descriptions and evaluates them.
 * <p>
 * A common prefix of at least five characters is suggested as a PREFIX rule; otherwise the
 * longest substring shared by all descriptions is suggested as a CONTAINS rule.
 */
@Slf4j
@Component
public class MerchantCriteriaBuilder {

    static final int MEANINGFUL_PREFIX_LENGTH = 5;
    static final int MEANINGFUL_SUBSTRING_LENGTH = 3;

    public MerchantCriteria suggest(List<String> descriptions) {
        if (descriptions.isEmpty()) {
            return MerchantCriteria.builder()
                    .commonSubstring("")
                    .commonPrefix("")
                    .commonSuffix("")
                    .suggestedPattern("")
                    .matchType(MatchType.CONTAINS)
                    .confidence(0.0)
                    .build();
        }

        List<String> normalized = descriptions.stream()
                .map(d -> d == null ? "" : d.toUpperCase(Locale.ROOT).trim())
                .collect(Collectors.toList());

        String substring = longestCommonSubstring(normalized);
        String prefix = commonPrefix(normalized);
        String suffix = commonSuffix(normalized);

        MatchType matchType = MatchType.CONTAINS;
        String suggested = substring;
        if (prefix.length() >= MEANINGFUL_PREFIX_LENGTH) {
            matchType = MatchType.PREFIX;
            suggested = prefix;
        }

        return MerchantCriteria.builder()
                .commonSubstring(substring)
                .commonPrefix(prefix)
                .commonSuffix(suffix)
                .variations(variations(normalized, substring))
                .suggestedPattern(suggested)
                .matchType(matchType)
                .confidence(confidence(normalized, suggested))
                .build();
    }

    /**
     * True when the suggestion is long enough to be used as a rule on its own.
     */
    public boolean isUsable(MerchantCriteria criteria) {
        return criteria.getSuggestedPattern().trim().length() >= MEANINGFUL_SUBSTRING_LENGTH;
    }

    /**
     * Builds a description predicate. Exclusions are checked first and veto a match.
     * Non-regex rules compare against the trimmed description.
     * An invalid REGEX pattern matches nothing.
     */
    public Predicate<String> matcher(String pattern, MatchType matchType, List<String> exclusions, boolean caseSensitive) {
        List<String> excluded = exclusions == null ? List.of() : exclusions.stream()
                .filter(e -> e != null && !e.isEmpty())
                .map(e -> caseSensitive ? e : e.toUpperCase(Locale.ROOT))
                .collect(Collectors.toList());

        if (matchType == MatchType.REGEX) {
            Pattern compiled;
            try {
                compiled = Pattern.compile(pattern, caseSensitive ? 0 : Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
                log.warn("Invalid merchant regex '{}': {}", pattern, e.getDescription());
                return description -> false;
            }
            return description -> {
                String text = description == null ? "" : description;
                String forExclusion = caseSensitive ? text : text.toUpperCase(Locale.ROOT);
                return excluded.stream().noneMatch(forExclusion::contains) && compiled.matcher(text).find();
            };
        }

        String needle = caseSensitive ? pattern : pattern.toUpperCase(Locale.ROOT);
        return description -> {
            // Same normalisation as suggest(), so a rule always matches the descriptions it came from
            String text = description == null ? "" : description.trim();
            String haystack = caseSensitive ? text : text.toUpperCase(Locale.ROOT);
            if (excluded.stream().anyMatch(haystack::contains)) {
                return false;
            }
            switch (matchType) {
                case EXACT:
                    return haystack.equals(needle.trim());
                case PREFIX:
                    return haystack.startsWith(needle);
                case SUFFIX:
                    return haystack.endsWith(needle);
                case CONTAINS:
                default:
                    return haystack.contains(needle);
            }
        };
    }

    /**
     * Renders a rule as a single regular expression for storage or export.
     */
    public String toRegex(String pattern, MatchType matchType, List<String> exclusions, boolean caseSensitive) {
        String escaped = matchType == MatchType.REGEX ? pattern : Pattern.quote(pattern);
        String regex;
        switch (matchType) {
            case EXACT:
                regex = "^" + escaped + "$";
                break;
            case PREFIX:
                regex = "^" + escaped;
                break;
            case SUFFIX:
                regex = escaped + "$";
                break;
            case REGEX:
            case CONTAINS:
            default:
                regex = escaped;
                break;
        }
        if (exclusions != null && !exclusions.isEmpty()) {
            String alternatives = exclusions.stream().map(Pattern::quote).collect(Collectors.joining("|"));
            regex = "(?!.*(" + alternatives + ")).*" + regex;
        }
        if (!caseSensitive) {
            regex = "(?i)" + regex;
        }
        return regex;
    }

    /**
     * Longest substring contained in every string; the leftmost one in the shortest string wins ties.
     */
    static String longestCommonSubstring(List<String> strings) {
        if (strings.isEmpty()) {
            return "";
        }
        String shortest = strings.stream().min(Comparator.comparingInt(String::length)).orElse("");
        for (int length = shortest.length(); length > 0; length--) {
            for (int start = 0; start + length <= shortest.length(); start++) {
                String candidate = shortest.substring(start, start + length);
                if (strings.stream().allMatch(s -> s.contains(candidate))) {
                    return candidate;
                }
            }
        }
        return "";
    }

    static String commonPrefix(List<String> strings) {
        if (strings.isEmpty()) {
            return "";
        }
        String prefix = strings.get(0);
        for (String s : strings) {
            while (!s.startsWith(prefix)) {
                prefix = prefix.substring(0, prefix.length() - 1);
            }
        }
        return prefix;
    }

    static String commonSuffix(List<String> strings) {
        List<String> reversed = strings.stream()
                .map(s -> new StringBuilder(s).reverse().toString())
                .collect(Collectors.toList());
        return new StringBuilder(commonPrefix(reversed)).reverse().toString();
    }

    static List<String> variations(List<String> strings, String common) {
        TreeSet<String> words = new TreeSet<>();
        for (String s : strings) {
            String remaining = common.isEmpty() ? s : s.replace(common, "");
            remaining = remaining.replace('.', ' ').replace('-', ' ').trim();
            if (!remaining.isEmpty()) {
                words.addAll(Arrays.asList(remaining.split("\\s+")));
            }
        }
        return List.copyOf(words);
    }

    /**
     * Average of a length score (saturating at 10 characters) and a position score that drops
     * as the pattern's offset varies across descriptions.
     */
    static double confidence(List<String> strings, String pattern) {
        if (pattern.isEmpty()) {
            return 0.0;
        }
        double lengthScore = Math.min(pattern.length() / 10.0, 1.0);
        int minPosition = Integer.MAX_VALUE;
        int maxPosition = Integer.MIN_VALUE;
        for (String s : strings) {
            int position = s.indexOf(pattern);
            minPosition = Math.min(minPosition, position);
            maxPosition = Math.max(maxPosition, position);
        }
        double positionScore = Math.max(0.0, 1.0 - (maxPosition - minPosition) / 100.0);
        return (lengthScore + positionScore) / 2.0;
    }
}
