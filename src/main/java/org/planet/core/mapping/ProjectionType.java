package org.planet.core.mapping;

public enum ProjectionType {
    /** Latitude and longitude both linear in the cell index. */
    EQUIRECTANGULAR,
    /** Longitude linear, latitude through the arcsine of a linear term: every row covers the same area. */
    CYLINDRICAL_EQUAL_AREA;

    public static ProjectionType parse(String s) {
        if (s == null || s.isBlank()) return EQUIRECTANGULAR;
        String v = s.trim().toUpperCase().replace('-', '_');
        if (v.equals("EQUAL_AREA")) return CYLINDRICAL_EQUAL_AREA;
        return ProjectionType.valueOf(v);
    }
}
