package fun.fengwk.stay.core.service.normalize;

import fun.fengwk.stay.core.facade.listing.model.RawListing;
import fun.fengwk.stay.core.service.search.SearchProperties;
import fun.fengwk.stay.core.service.search.model.Property;
import fun.fengwk.stay.core.utils.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw provider records into {@link Property} values.
 *
 * <p>Every field is read through an ordered list of candidate paths and falls back to a default,
 * only a missing identifier drops the record.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultNormalizer {

    public static final int DEFAULT_PRICE = 100;
    public static final String DEFAULT_CURRENCY = "USD";
    public static final String DEFAULT_TITLE = "Untitled property";
    public static final String DEFAULT_LOCATION = "Unknown location";
    public static final String DEFAULT_TYPE = "Entire home";
    public static final int DEFAULT_GUESTS = 2;
    public static final int DEFAULT_BEDROOMS = 1;
    public static final int DEFAULT_BATHROOMS = 1;

    static final int MAX_TITLE_LENGTH = 200;
    static final int MAX_LOCATION_LENGTH = 100;
    static final int MAX_TYPE_LENGTH = 50;
    static final int MAX_AMENITIES = 20;

    private static final int MAX_NESTING = 5;

    private static final List<String> PRICE_KEYS = List.of("price", "amount", "value", "cost");
    private static final List<String> IMAGE_KEYS = List.of("picture", "url", "src", "image");
    private static final List<String> AMENITY_KEYS = List.of("name", "title", "label");

    private static final List<String> ID_PATHS = List.of(
        "listing.id", "id", "listingId", "listing.listingId", "roomId", "room_id");
    private static final List<String> TITLE_PATHS = List.of(
        "listing.title", "listing.name", "title", "name");
    private static final List<String> LOCATION_PATHS = List.of(
        "listing.city", "listing.localizedCityName", "listing.publicAddress", "city", "location", "address");
    private static final List<String> URL_PATHS = List.of(
        "listing.url", "url", "listingUrl");
    private static final List<String> TYPE_PATHS = List.of(
        "listing.roomTypeCategory", "listing.roomType", "listing.propertyType", "roomType", "propertyType", "type");
    private static final List<String> PRICE_PATHS = List.of(
        "pricingQuote.structuredStayDisplayPrice.primaryLine.price",
        "pricingQuote.structuredStayDisplayPrice.primaryLine.discountedPrice",
        "pricingQuote.rate.amount",
        "pricingQuote.price",
        "price",
        "listing.price");
    private static final List<String> CURRENCY_PATHS = List.of(
        "pricingQuote.rate.currency", "pricingQuote.currency", "currency");
    private static final List<String> RATING_PATHS = List.of(
        "listing.avgRatingLocalized", "listing.avgRating", "avgRating", "rating");
    private static final List<String> REVIEW_COUNT_PATHS = List.of(
        "listing.reviewsCount", "reviewsCount", "reviewCount", "listing.reviewCount");
    private static final List<String> IMAGE_PATHS = List.of(
        "listing.contextualPictures", "listing.pictures", "contextualPictures", "pictures",
        "images", "listing.picture", "picture", "imageUrl", "image");
    private static final List<String> GUEST_PATHS = List.of(
        "listing.personCapacity", "listing.guests", "personCapacity", "guests", "maxGuests");
    private static final List<String> BEDROOM_PATHS = List.of(
        "listing.bedrooms", "bedrooms", "listing.bedroomCount");
    private static final List<String> BATHROOM_PATHS = List.of(
        "listing.bathrooms", "bathrooms", "listing.bathroomCount");
    private static final List<String> AMENITY_PATHS = List.of(
        "listing.amenities", "amenities", "listing.previewAmenityNames", "previewAmenities");

    private static final Pattern NON_PRICE_CHARS = Pattern.compile("[^\\d.]");
    private static final Pattern RATING_WITH_REVIEWS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*\\(\\s*(\\d[\\d,]*)\\s*\\)");
    private static final Pattern BARE_RATING = Pattern.compile("(\\d+(?:\\.\\d+)?)");
    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

    private final SearchProperties searchProperties;

    /**
     * Normalize one record.
     *
     * @return empty when the record has no usable identifier
     */
    public Optional<Property> normalize(RawListing raw) {
        if (raw == null || raw.getFields() == null) {
            return Optional.empty();
        }
        Map<String, Object> doc = raw.getFields();

        Optional<String> id = DocumentProbes.firstText(doc, ID_PATHS);
        if (id.isEmpty()) {
            log.debug("listing without id dropped, sourceLocation={}", raw.getSourceLocation());
            return Optional.empty();
        }

        Rating rating = DocumentProbes.first(doc, RATING_PATHS)
            .map(ResultNormalizer::extractRating)
            .orElse(Rating.DEFAULT);
        int reviewCount = DocumentProbes.firstCount(doc, REVIEW_COUNT_PATHS).orElse(rating.reviewCount());

        String fallbackLocation = StringUtils.isNotBlank(raw.getSourceLocation())
            ? raw.getSourceLocation()
            : DEFAULT_LOCATION;

        Property property = Property.builder()
            .id(id.get())
            .title(TextUtils.truncate(DocumentProbes.firstText(doc, TITLE_PATHS).orElse(DEFAULT_TITLE), MAX_TITLE_LENGTH))
            .price(DocumentProbes.first(doc, PRICE_PATHS).map(ResultNormalizer::extractPrice).orElse(DEFAULT_PRICE))
            .currency(extractCurrency(doc))
            .rating(rating.value())
            .reviewCount(reviewCount)
            .imageUrl(extractImage(doc))
            .location(TextUtils.truncate(DocumentProbes.firstText(doc, LOCATION_PATHS).orElse(fallbackLocation), MAX_LOCATION_LENGTH))
            .sourceLocation(raw.getSourceLocation())
            .url(DocumentProbes.first(doc, URL_PATHS).flatMap(DocumentProbes::absoluteUrl).orElseGet(() -> listingUrl(id.get())))
            .type(TextUtils.truncate(DocumentProbes.firstText(doc, TYPE_PATHS).orElse(DEFAULT_TYPE), MAX_TYPE_LENGTH))
            .guests(DocumentProbes.firstCount(doc, GUEST_PATHS).orElse(DEFAULT_GUESTS))
            .bedrooms(DocumentProbes.firstCount(doc, BEDROOM_PATHS).orElse(DEFAULT_BEDROOMS))
            .bathrooms(DocumentProbes.firstCount(doc, BATHROOM_PATHS).orElse(DEFAULT_BATHROOMS))
            .amenities(extractAmenities(doc))
            .build();
        return Optional.of(property);
    }

    /**
     * Normalize a batch, a failing record is logged and skipped.
     */
    public List<Property> normalizeAll(Collection<RawListing> raws) {
        if (raws == null || raws.isEmpty()) {
            return Collections.emptyList();
        }
        List<Property> properties = new ArrayList<>(raws.size());
        for (RawListing raw : raws) {
            try {
                normalize(raw).ifPresent(properties::add);
            } catch (RuntimeException ex) {
                log.warn("normalize listing failed, sourceLocation={}, error={}",
                    raw == null ? null : raw.getSourceLocation(), ex.toString());
            }
        }
        return properties;
    }

    /**
     * Price from a number, a price string like {@code "$1,250"} or a map holding one of
     * {@code price, amount, value, cost}; {@value #DEFAULT_PRICE} when nothing usable is found.
     */
    public static int extractPrice(Object value) {
        return extractPrice(value, 0);
    }

    private static int extractPrice(Object value, int depth) {
        if (value instanceof Number number) {
            return toPrice(number.doubleValue());
        }
        if (value instanceof String str) {
            String digits = NON_PRICE_CHARS.matcher(str).replaceAll("");
            if (digits.isEmpty()) {
                return DEFAULT_PRICE;
            }
            try {
                return toPrice(Double.parseDouble(digits));
            } catch (NumberFormatException ex) {
                return DEFAULT_PRICE;
            }
        }
        if (value instanceof Map<?, ?> map && depth < MAX_NESTING) {
            for (String key : PRICE_KEYS) {
                Object nested = map.get(key);
                if (nested != null) {
                    return extractPrice(nested, depth + 1);
                }
            }
        }
        return DEFAULT_PRICE;
    }

    private static int toPrice(double amount) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            return DEFAULT_PRICE;
        }
        return (int) Math.max(0, amount);
    }

    /**
     * Rating from a number, {@code "New"}, {@code "4.85 (120)"} or a bare {@code "4.85"}.
     */
    public static Rating extractRating(Object value) {
        if (value instanceof Number number) {
            double rating = number.doubleValue();
            if (Double.isNaN(rating)) {
                return Rating.DEFAULT;
            }
            return new Rating(clampRating(rating), 0);
        }
        if (value instanceof String str) {
            String text = str.trim();
            if ("new".equalsIgnoreCase(text)) {
                return Rating.NEW_LISTING;
            }
            Matcher withReviews = RATING_WITH_REVIEWS.matcher(text);
            if (withReviews.find()) {
                return new Rating(clampRating(Double.parseDouble(withReviews.group(1))),
                    parseReviewCount(withReviews.group(2)));
            }
            Matcher bare = BARE_RATING.matcher(text);
            if (bare.find()) {
                return new Rating(clampRating(Double.parseDouble(bare.group(1))), 0);
            }
        }
        return Rating.DEFAULT;
    }

    private static double clampRating(double rating) {
        return Math.max(0, Math.min(5, rating));
    }

    private static int parseReviewCount(String digits) {
        String plain = digits.replace(",", "");
        if (plain.length() > 9) {
            return Integer.MAX_VALUE;
        }
        return Integer.parseInt(plain);
    }

    /**
     * First absolute image url from a string, a list of strings or maps, or a map probed under
     * {@code picture, url, src, image}.
     */
    public static Optional<String> extractImageUrl(Object value) {
        return extractImageUrl(value, 0);
    }

    private static Optional<String> extractImageUrl(Object value, int depth) {
        if (value instanceof String) {
            return DocumentProbes.absoluteUrl(value);
        }
        if (depth >= MAX_NESTING) {
            return Optional.empty();
        }
        if (value instanceof List<?> list) {
            for (Object item : list) {
                Optional<String> url = extractImageUrl(item, depth + 1);
                if (url.isPresent()) {
                    return url;
                }
            }
            return Optional.empty();
        }
        if (value instanceof Map<?, ?> map) {
            for (String key : IMAGE_KEYS) {
                Object nested = map.get(key);
                if (nested instanceof String) {
                    Optional<String> url = DocumentProbes.absoluteUrl(nested);
                    if (url.isPresent()) {
                        return url;
                    }
                }
            }
        }
        return Optional.empty();
    }

    private String extractImage(Map<String, Object> doc) {
        for (String candidate : IMAGE_PATHS) {
            Optional<String> url = DocumentProbes.path(doc, candidate).flatMap(ResultNormalizer::extractImageUrl);
            if (url.isPresent()) {
                return url.get();
            }
        }
        return searchProperties.getPlaceholderImageUrl();
    }

    private static String extractCurrency(Map<String, Object> doc) {
        for (String candidate : CURRENCY_PATHS) {
            Optional<String> code = DocumentProbes.path(doc, candidate)
                .flatMap(DocumentProbes::text)
                .map(text -> text.toUpperCase(Locale.ROOT))
                .filter(text -> CURRENCY_CODE.matcher(text).matches());
            if (code.isPresent()) {
                return code.get();
            }
        }
        return DEFAULT_CURRENCY;
    }

    private static List<String> extractAmenities(Map<String, Object> doc) {
        for (String candidate : AMENITY_PATHS) {
            Optional<Object> value = DocumentProbes.path(doc, candidate);
            if (value.isEmpty()) {
                continue;
            }
            List<String> amenities = toAmenities(value.get());
            if (!amenities.isEmpty()) {
                return amenities;
            }
        }
        return Collections.emptyList();
    }

    private static List<String> toAmenities(Object value) {
        Set<String> amenities = new LinkedHashSet<>();
        if (value instanceof String str) {
            for (String part : StringUtils.split(str, ',')) {
                DocumentProbes.text(part).ifPresent(amenities::add);
            }
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    AMENITY_KEYS.stream()
                        .map(map::get)
                        .map(DocumentProbes::text)
                        .flatMap(Optional::stream)
                        .findFirst()
                        .ifPresent(amenities::add);
                } else if (item instanceof String) {
                    DocumentProbes.text(item).ifPresent(amenities::add);
                }
            }
        }
        return amenities.stream().limit(MAX_AMENITIES).toList();
    }

    private String listingUrl(String id) {
        return searchProperties.getListingBaseUrl() + URLEncoder.encode(id, StandardCharsets.UTF_8);
    }

}
