package net.clipforge.application.generation;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prompt and aspect-ratio rules applied before a clip request is sent.
 */
public final class ClipPromptPolicy {

    public static final int MAX_PROMPT_LENGTH = 1000;
    public static final int CLIP_DURATION_SECONDS = 5;
    public static final String DEFAULT_RATIO = "1280:720";
    public static final List<String> SUPPORTED_RATIOS = List.of(
        "1280:720", "720:1280", "1104:832", "832:1104", "960:960", "1584:672", "1280:768", "768:1280");

    private static final List<String> GEN3_RATIOS = List.of("1280:768", "768:1280");
    private static final String GEN3_MODEL = "gen3a_turbo";
    private static final String GEN4_MODEL = "gen4_turbo";

    private static final String SAFETY_PREFACE = String.join(" ",
        "Animate the given image faithfully with subtle, natural motion.",
        "Do not change the subject identity, clothing, background, or lighting conditions.",
        "Avoid adding new objects, text, or elements not present in the image.",
        "Keep movements smooth and minimal: gentle camera drift, minor environmental motion.",
        "Preserve composition and style; emphasize temporal consistency and realism.");

    private static final Map<String, String> SHORTHAND_RATIOS = Map.of(
        "16:9", "1280:720",
        "9:16", "720:1280",
        "4:3", "1104:832",
        "3:4", "832:1104",
        "1:1", "960:960",
        "2.35:1", "1584:672",
        "21:9", "1584:672");

    private static final Pattern NUMERIC_RATIO = Pattern.compile("^(\\d+(?:\\.\\d+)?)[:x](\\d+(?:\\.\\d+)?)$");
    private static final Pattern SINGLE_NUMBER = Pattern.compile("^\\d+(?:\\.\\d+)?$");

    private ClipPromptPolicy() {
    }

    /**
     * Prepends the fidelity preface and truncates to {@value #MAX_PROMPT_LENGTH} characters.
     */
    public static String buildSafePrompt(String userPrompt) {
        String combined = (SAFETY_PREFACE + " " + (userPrompt == null ? "" : userPrompt)).trim();
        if (combined.length() > MAX_PROMPT_LENGTH) {
            return combined.substring(0, MAX_PROMPT_LENGTH - 3) + "...";
        }
        return combined;
    }

    /**
     * Maps shorthand and approximate ratios onto the closest supported ratio.
     * Blank or unparseable input yields {@value #DEFAULT_RATIO}.
     */
    public static String normalizeRatio(String input) {
        if (input == null || input.isBlank()) {
            return DEFAULT_RATIO;
        }
        String cleaned = input.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        if (SUPPORTED_RATIOS.contains(cleaned)) {
            return cleaned;
        }
        String shorthand = SHORTHAND_RATIOS.get(cleaned);
        if (shorthand != null) {
            return shorthand;
        }
        if (SINGLE_NUMBER.matcher(cleaned).matches()) {
            return closestTo(Double.parseDouble(cleaned));
        }
        Matcher matcher = NUMERIC_RATIO.matcher(cleaned);
        if (matcher.matches()) {
            double width = Double.parseDouble(matcher.group(1));
            double height = Double.parseDouble(matcher.group(2));
            if (width > 0 && height > 0) {
                String direct = formatRatio(width, height);
                if (SUPPORTED_RATIOS.contains(direct)) {
                    return direct;
                }
                return closestTo(width / height);
            }
        }
        return DEFAULT_RATIO;
    }

    public static String modelFor(String ratio) {
        return GEN3_RATIOS.contains(ratio) ? GEN3_MODEL : GEN4_MODEL;
    }

    /**
     * Builds the request for one frame, applying prompt and ratio rules.
     */
    public static GenerationRequest requestFor(String imageUrl, String prompt, String ratio) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new IllegalArgumentException("A start image URL is required");
        }
        String normalizedRatio = normalizeRatio(ratio);
        return new GenerationRequest(
            modelFor(normalizedRatio), imageUrl, buildSafePrompt(prompt), normalizedRatio, CLIP_DURATION_SECONDS);
    }

    private static String closestTo(double target) {
        String best = DEFAULT_RATIO;
        double bestDistance = Double.MAX_VALUE;
        for (String candidate : SUPPORTED_RATIOS) {
            String[] parts = candidate.split(":");
            double value = Double.parseDouble(parts[0]) / Double.parseDouble(parts[1]);
            double distance = Math.abs(value - target);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = candidate;
            }
        }
        return best;
    }

    private static String formatRatio(double width, double height) {
        if (width == Math.rint(width) && height == Math.rint(height)) {
            return (long) width + ":" + (long) height;
        }
        return "";
    }
}
