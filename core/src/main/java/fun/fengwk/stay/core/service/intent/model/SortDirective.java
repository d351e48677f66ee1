package fun.fengwk.stay.core.service.intent.model;

/**
 * Ordering requested by the query.
 *
 * @author fengwk
 */
public enum SortDirective {

    NONE("none"),
    PRICE_ASC("price_asc"),
    PRICE_DESC("price_desc");

    private final String code;

    SortDirective(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

}
