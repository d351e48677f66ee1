package fun.fengwk.stay.core.service.normalize;

/**
 * Rating value with the review count found next to it.
 *
 * @author fengwk
 */
public record Rating(double value, int reviewCount) {

    public static final Rating DEFAULT = new Rating(4.5, 0);

    public static final Rating NEW_LISTING = new Rating(0, 0);

}
