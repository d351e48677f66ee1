package fun.fengwk.stay.core.service.intent.model;

/**
 * Property size preference requested by the query.
 *
 * @author fengwk
 */
public enum SizePreference {

    NONE("none"),
    SMALL("small"),
    LARGE("large");

    private final String code;

    SizePreference(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

}
