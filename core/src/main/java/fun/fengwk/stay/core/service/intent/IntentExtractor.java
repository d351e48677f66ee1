package fun.fengwk.stay.core.service.intent;

import fun.fengwk.stay.core.service.intent.model.SearchIntent;
import fun.fengwk.stay.core.service.intent.model.SizePreference;
import fun.fengwk.stay.core.service.intent.model.SortDirective;
import fun.fengwk.stay.core.utils.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free text into a {@link SearchIntent}.
 *
 * <p>Locations are resolved in priority order: global keywords, region keywords, then the ordered
 * {@link LocationRule} list where the first rule yielding a valid name wins. Criteria (sort, size,
 * price, bedrooms, guests, property type) are extracted independently of the locations.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class IntentExtractor {

    static final List<String> GLOBAL_LOCATIONS = List.of("New York", "London", "Paris", "Tokyo", "Sydney");

    private static final int MAX_REGION_LOCATIONS = 5;
    private static final int MAX_LOCATION_LENGTH = 100;
    private static final int MIN_LOCATION_LENGTH = 2;
    private static final int MAX_PRICE = 50000;
    private static final int MAX_BEDROOMS = 50;

    private static final Pattern GLOBAL_PATTERN = Pattern.compile(
        "\\b(globally|global|worldwide|world-wide|anywhere|around the world|internationally|international"
            + "|across (?:multiple|different|many|several) countries|multiple countries)\\b");

    private static final Map<Pattern, List<String>> REGION_LOCATIONS = new LinkedHashMap<>();

    static {
        REGION_LOCATIONS.put(Pattern.compile("\\beurop(?:e|ean)\\b"),
            List.of("London", "Paris", "Barcelona", "Rome", "Amsterdam"));
        REGION_LOCATIONS.put(Pattern.compile("\\basian?\\b"),
            List.of("Tokyo", "Bangkok", "Singapore", "Seoul", "Bali"));
        REGION_LOCATIONS.put(Pattern.compile("\\bnorth america\\b"),
            List.of("New York", "Los Angeles", "Miami", "Toronto", "Vancouver"));
        REGION_LOCATIONS.put(Pattern.compile("\\b(?:south|latin) america\\b"),
            List.of("Rio de Janeiro", "Buenos Aires", "Lima", "Bogota", "Santiago"));
        REGION_LOCATIONS.put(Pattern.compile("\\boceania\\b"),
            List.of("Sydney", "Melbourne", "Auckland", "Brisbane", "Perth"));
    }

    private static final Pattern PRICE_ASC_PATTERN = Pattern.compile(
        "\\b(cheapest|cheap|budget|affordable|lowest price|lowest-priced|inexpensive|least expensive)\\b");
    private static final Pattern PRICE_DESC_PATTERN = Pattern.compile(
        "\\b(most expensive|luxury|luxurious|premium|highest price|high-end|upscale)\\b");
    private static final Pattern SIZE_LARGE_PATTERN = Pattern.compile("\\b(large|largest|big|biggest|huge|spacious)\\b");
    private static final Pattern SIZE_SMALL_PATTERN = Pattern.compile("\\b(small|smallest|tiny|cozy|cosy)\\b");

    private static final String NUMBER =
        "(\\d{1,3}|one|two|three|four|five|six|seven|eight|nine|ten|eleven|twelve|thirteen|fourteen"
            + "|fifteen|sixteen|seventeen|eighteen|nineteen|twenty)";
    private static final Pattern BEDROOM_PATTERN = Pattern.compile(
        "\\b" + NUMBER + "\\s*\\+?\\s*-?\\s*(?:bedrooms?|beds?|br|bdrms?)\\b");
    private static final Pattern GUEST_PATTERN = Pattern.compile(
        "\\b" + NUMBER + "\\s*\\+?\\s*(?:people|persons?|guests?|adults?|travell?ers|pax)\\b");

    private static final String AMOUNT = "\\$?\\s*(\\d[\\d,]*)(?![\\d,])(?!\\s*\\+?\\s*(?:bed|br|bdrm|people|person|guest|adult|night|day|week))";
    private static final Pattern PRICE_BETWEEN_PATTERN = Pattern.compile(
        "\\bbetween\\s*\\$?\\s*(\\d[\\d,]*)\\s*(?:and|-|to)\\s*" + AMOUNT);
    private static final Pattern PRICE_RANGE_PATTERN = Pattern.compile(
        "\\$\\s*(\\d[\\d,]*)\\s*(?:-|to)\\s*" + AMOUNT);
    private static final Pattern PRICE_MAX_PATTERN = Pattern.compile(
        "\\b(?:under|below|less than|up to|max(?:imum)?|at most|cheaper than|no more than)\\s*" + AMOUNT);
    private static final Pattern PRICE_MIN_PATTERN = Pattern.compile(
        "\\b(?:over|above|more than|at least|min(?:imum)?)\\s*" + AMOUNT);
    private static final Pattern PRICE_FROM_PATTERN = Pattern.compile(
        "\\b(?:from|starting at)\\s*\\$\\s*(\\d[\\d,]*)");

    private static final Pattern PROPERTY_TYPE_PATTERN = Pattern.compile(
        "\\b(house|home|apartment|flat|villa|cabin|condo|studio|loft|cottage|estate|mansion|bungalow|chalet"
            + "|townhouse|room)(?:e?s)?\\b");

    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
        Map.entry("one", 1), Map.entry("two", 2), Map.entry("three", 3), Map.entry("four", 4),
        Map.entry("five", 5), Map.entry("six", 6), Map.entry("seven", 7), Map.entry("eight", 8),
        Map.entry("nine", 9), Map.entry("ten", 10), Map.entry("eleven", 11), Map.entry("twelve", 12),
        Map.entry("thirteen", 13), Map.entry("fourteen", 14), Map.entry("fifteen", 15),
        Map.entry("sixteen", 16), Map.entry("seventeen", 17), Map.entry("eighteen", 18),
        Map.entry("nineteen", 19), Map.entry("twenty", 20)
    );

    /**
     * Words that end a captured location phrase.
     */
    private static final Set<String> BOUNDARY_WORDS = Set.of(
        "in", "near", "at", "around", "to", "for", "with", "without", "within", "under", "below", "over",
        "above", "between", "from", "during", "on", "less", "more", "max", "min", "up", "and", "or", "but",
        "that", "which", "who", "where", "when", "by", "next", "this", "these", "those", "starting", "cheaper"
    );

    /**
     * Words that never belong to a location name.
     */
    private static final Set<String> STOP_WORDS = Set.of(
        // articles, pronouns and filler verbs
        "a", "an", "the", "i", "me", "my", "we", "us", "our", "you", "find", "finding", "looking", "look",
        "search", "searching", "show", "get", "book", "need", "want", "like", "would", "please", "some", "any",
        "visit", "visiting", "go", "going", "travel", "traveling", "travelling",
        // prepositions and conjunctions
        "in", "near", "at", "around", "to", "for", "with", "of", "on", "and", "or", "from", "under", "below",
        "over", "above", "between", "across",
        // adjectives
        "cheap", "cheapest", "budget", "budget-friendly", "affordable", "inexpensive", "expensive", "most",
        "least", "luxury", "luxurious", "premium", "upscale", "high-end", "large", "largest", "big", "biggest",
        "huge", "spacious", "small", "smallest", "tiny", "cozy", "cosy", "nice", "beautiful", "best", "good",
        "great", "modern", "charming", "quiet", "lovely", "unique", "family", "friendly", "family-friendly",
        "pet-friendly", "romantic", "private", "entire", "whole", "top", "rated", "highest", "lowest", "price",
        "priced", "globally", "worldwide", "anywhere", "multiple", "countries",
        // property and room nouns
        "place", "places", "stay", "stays", "staying", "accommodation", "accommodations", "lodging", "rental",
        "rentals", "property", "properties", "home", "homes", "house", "houses", "apartment", "apartments",
        "flat", "flats", "villa", "villas", "cabin", "cabins", "condo", "condos", "studio", "studios", "loft",
        "lofts", "cottage", "cottages", "estate", "estates", "mansion", "mansions", "bungalow", "bungalows",
        "chalet", "chalets", "townhouse", "townhouses", "room", "rooms", "bedroom", "bedrooms", "bathroom",
        "bathrooms", "bed", "beds", "br", "hotel", "hotels", "suite", "suites",
        // amenity nouns
        "pool", "pools", "wifi", "kitchen", "parking", "garden", "gym", "spa", "balcony", "fireplace", "washer",
        "dryer", "pet", "pets",
        // group and trip words
        "people", "persons", "person", "guests", "guest", "adults", "adult", "group", "groups", "travelers",
        "travellers", "friends", "vacation", "trip", "holiday", "weekend", "night", "nights", "week"
    );

    private static final Pattern LOCATION_CHAR_PATTERN = Pattern.compile("[^\\p{L}\\s'-]");
    private static final Pattern CLAUSE_SPLIT_PATTERN = Pattern.compile("[,.;!?]");

    private final IntentProperties properties;
    private final List<LocationRule> locationRules;

    public IntentExtractor(IntentProperties properties) {
        this.properties = properties;
        this.locationRules = List.of(
            prepositionRule("in"),
            prepositionRule("near"),
            prepositionRule("at"),
            prepositionRule("around"),
            prepositionRule("visit|visiting"),
            prepositionRule("to"),
            IntentExtractor::lastClause
        );
    }

    /**
     * Extract the intent, never fails.
     */
    public SearchIntent extract(String rawQuery) {
        String query = rawQuery == null ? "" : StringUtils.normalizeSpace(rawQuery).toLowerCase(Locale.ROOT);

        Integer bedrooms = extractBedrooms(query);
        Integer explicitGuests = extractGuests(query);
        int guests = resolveGuests(bedrooms, explicitGuests);
        Integer[] priceBounds = extractPriceBounds(query);

        SearchIntent intent = SearchIntent.builder()
            .locations(extractLocations(query))
            .sortBy(extractSortDirective(query))
            .propertySize(extractSizePreference(query))
            .priceMin(priceBounds[0])
            .priceMax(priceBounds[1])
            .bedrooms(bedrooms)
            .guests(guests)
            .propertyType(extractPropertyType(query))
            .build();
        log.debug("extracted intent, query={}, intent={}", query, intent);
        return intent;
    }

    List<String> extractLocations(String query) {
        if (GLOBAL_PATTERN.matcher(query).find()) {
            return limitLocations(GLOBAL_LOCATIONS);
        }

        List<String> regional = new ArrayList<>();
        for (Map.Entry<Pattern, List<String>> entry : REGION_LOCATIONS.entrySet()) {
            if (entry.getKey().matcher(query).find()) {
                List<String> cities = entry.getValue();
                regional.addAll(cities.subList(0, Math.min(MAX_REGION_LOCATIONS, cities.size())));
            }
        }
        if (!regional.isEmpty()) {
            return limitLocations(regional);
        }

        for (LocationRule rule : locationRules) {
            Optional<String> location = rule.extract(query);
            if (location.isPresent()) {
                return List.of(location.get());
            }
        }
        return List.of(properties.getDefaultLocation());
    }

    SortDirective extractSortDirective(String query) {
        if (PRICE_ASC_PATTERN.matcher(query).find()) {
            return SortDirective.PRICE_ASC;
        }
        if (PRICE_DESC_PATTERN.matcher(query).find()) {
            return SortDirective.PRICE_DESC;
        }
        return SortDirective.NONE;
    }

    SizePreference extractSizePreference(String query) {
        if (SIZE_LARGE_PATTERN.matcher(query).find()) {
            return SizePreference.LARGE;
        }
        if (SIZE_SMALL_PATTERN.matcher(query).find()) {
            return SizePreference.SMALL;
        }
        return SizePreference.NONE;
    }

    /**
     * @return two-element array of {min, max}, each possibly null
     */
    Integer[] extractPriceBounds(String query) {
        Integer min = null;
        Integer max = null;

        Matcher between = PRICE_BETWEEN_PATTERN.matcher(query);
        Matcher range = PRICE_RANGE_PATTERN.matcher(query);
        if (between.find()) {
            min = parseAmount(between.group(1));
            max = parseAmount(between.group(2));
        } else if (range.find()) {
            min = parseAmount(range.group(1));
            max = parseAmount(range.group(2));
        }

        if (max == null) {
            Matcher maxMatcher = PRICE_MAX_PATTERN.matcher(query);
            if (maxMatcher.find()) {
                max = parseAmount(maxMatcher.group(1));
            }
        }
        if (min == null) {
            Matcher minMatcher = PRICE_MIN_PATTERN.matcher(query);
            Matcher fromMatcher = PRICE_FROM_PATTERN.matcher(query);
            if (minMatcher.find()) {
                min = parseAmount(minMatcher.group(1));
            } else if (fromMatcher.find()) {
                min = parseAmount(fromMatcher.group(1));
            }
        }

        if (min != null && max != null && min > max) {
            Integer swap = min;
            min = max;
            max = swap;
        }
        return new Integer[]{min, max};
    }

    Integer extractBedrooms(String query) {
        Matcher matcher = BEDROOM_PATTERN.matcher(query);
        if (!matcher.find()) {
            return null;
        }
        Integer bedrooms = parseNumber(matcher.group(1));
        return bedrooms == null ? null : Math.min(bedrooms, MAX_BEDROOMS);
    }

    Integer extractGuests(String query) {
        Matcher matcher = GUEST_PATTERN.matcher(query);
        if (!matcher.find()) {
            return null;
        }
        return parseNumber(matcher.group(1));
    }

    String extractPropertyType(String query) {
        Matcher matcher = PROPERTY_TYPE_PATTERN.matcher(query);
        if (!matcher.find()) {
            return null;
        }
        String type = matcher.group(1);
        if ("home".equals(type)) {
            return "house";
        }
        if ("flat".equals(type)) {
            return "apartment";
        }
        return type;
    }

    private int resolveGuests(Integer bedrooms, Integer explicitGuests) {
        int guests;
        if (explicitGuests != null && explicitGuests > 0) {
            guests = explicitGuests;
        } else if (bedrooms != null && bedrooms > 0) {
            guests = bedrooms * 2;
        } else {
            guests = 2;
        }
        return Math.min(guests, properties.getMaxGuests());
    }

    private List<String> limitLocations(List<String> candidates) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (String candidate : candidates) {
            unique.putIfAbsent(candidate.toLowerCase(Locale.ROOT), candidate);
        }
        List<String> locations = new ArrayList<>(unique.values());
        int max = Math.max(1, properties.getMaxLocations());
        return locations.size() > max ? new ArrayList<>(locations.subList(0, max)) : locations;
    }

    private static LocationRule prepositionRule(String keywords) {
        Pattern pattern = Pattern.compile("\\b(?:" + keywords + ")\\s+([^,.;!?]+)");
        return query -> {
            Matcher matcher = pattern.matcher(query);
            while (matcher.find()) {
                Optional<String> location = cleanLocation(cutAtBoundary(matcher.group(1)));
                if (location.isPresent()) {
                    return location;
                }
            }
            return Optional.empty();
        };
    }

    private static Optional<String> lastClause(String query) {
        String[] clauses = CLAUSE_SPLIT_PATTERN.split(query);
        for (int i = clauses.length - 1; i >= 0; i--) {
            if (StringUtils.isNotBlank(clauses[i])) {
                return cleanLocation(clauses[i]);
            }
        }
        return Optional.empty();
    }

    private static String cutAtBoundary(String phrase) {
        StringBuilder builder = new StringBuilder();
        for (String word : StringUtils.split(phrase)) {
            if (BOUNDARY_WORDS.contains(word) || word.startsWith("$") || StringUtils.containsAny(word, "0123456789")) {
                break;
            }
            builder.append(word).append(' ');
        }
        return builder.toString();
    }

    private static Optional<String> cleanLocation(String phrase) {
        if (StringUtils.isBlank(phrase)) {
            return Optional.empty();
        }
        StringBuilder builder = new StringBuilder();
        for (String word : StringUtils.split(phrase)) {
            String bare = StringUtils.strip(word, "\"'");
            if (STOP_WORDS.contains(bare) || StringUtils.containsAny(bare, "0123456789$")) {
                continue;
            }
            builder.append(bare).append(' ');
        }
        String residue = StringUtils.normalizeSpace(LOCATION_CHAR_PATTERN.matcher(builder).replaceAll(""));
        residue = StringUtils.strip(residue, "'- ");
        if (residue.length() < MIN_LOCATION_LENGTH || !TextUtils.containsLetter(residue)) {
            return Optional.empty();
        }
        return Optional.of(TextUtils.truncate(TextUtils.titleCase(residue), MAX_LOCATION_LENGTH));
    }

    private static Integer parseNumber(String token) {
        Integer word = NUMBER_WORDS.get(token);
        if (word != null) {
            return word;
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            log.debug("not a number, token={}", token);
            return null;
        }
    }

    private static Integer parseAmount(String token) {
        String digits = StringUtils.remove(token, ',');
        if (StringUtils.isEmpty(digits)) {
            return null;
        }
        if (digits.length() > 6) {
            return MAX_PRICE;
        }
        return Math.min(Integer.parseInt(digits), MAX_PRICE);
    }

}
