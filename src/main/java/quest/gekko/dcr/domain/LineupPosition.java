package quest.gekko.dcr.domain;

import java.util.Arrays;
import java.util.Optional;

public enum LineupPosition {
    MFG1("mfg1", EntityType.MANUFACTURER),
    MFG2("mfg2", EntityType.MANUFACTURER),
    CSTR1("cstr1", EntityType.STRAIN),
    CSTR2("cstr2", EntityType.STRAIN),
    PRD1("prd1", EntityType.PRODUCT),
    PRD2("prd2", EntityType.PRODUCT),
    PHM1("phm1", EntityType.PHARMACY),
    PHM2("phm2", EntityType.PHARMACY),
    BRD1("brd1", EntityType.BRAND),
    FLEX("flex", null);

    private final String code;
    private final EntityType fixedType;

    LineupPosition(String code, EntityType fixedType) {
        this.code = code;
        this.fixedType = fixedType;
    }

    public String code() { return code; }

    /** Empty for {@link #FLEX}, whose type is whatever the slot currently holds. */
    public Optional<EntityType> fixedType() { return Optional.ofNullable(fixedType); }

    public static Optional<LineupPosition> fromCode(String code) {
        if (code == null) return Optional.empty();
        return Arrays.stream(values()).filter(p -> p.code.equalsIgnoreCase(code.trim())).findFirst();
    }
}
