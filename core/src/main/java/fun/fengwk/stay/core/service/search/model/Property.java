package fun.fengwk.stay.core.service.search.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Normalized listing.
 *
 * @author fengwk
 */
@Data
@Builder
public class Property {

    private String id;
    private String title;

    /**
     * Nightly price, whole currency units.
     */
    private int price;

    private String currency;

    /**
     * Rating in [0, 5], 0 for listings without reviews.
     */
    private double rating;

    private int reviewCount;
    private String imageUrl;
    private String location;
    private String sourceLocation;
    private String url;
    private String type;
    private int guests;
    private int bedrooms;
    private int bathrooms;
    private List<String> amenities;

}
