package com.centinel.core.normalizer;

import com.centinel.core.model.Geography;

import java.text.Normalizer;
import java.util.*;

/**
 * Two-digit codes of the Honduran departments as used by the electoral
 * authority. Lookups ignore case and accents.
 */
public final class DepartmentCodes {

    private static final Map<String, String> NAMES_BY_CODE;
    private static final Map<String, String> CODES_BY_KEY;

    static {
        Map<String, String> names = new LinkedHashMap<>();
        names.put("01", "Atlántida");
        names.put("02", "Choluteca");
        names.put("03", "Colón");
        names.put("04", "Comayagua");
        names.put("05", "Copán");
        names.put("06", "Cortés");
        names.put("07", "El Paraíso");
        names.put("08", "Francisco Morazán");
        names.put("09", "Gracias a Dios");
        names.put("10", "Intibucá");
        names.put("11", "Islas de la Bahía");
        names.put("12", "La Paz");
        names.put("13", "Lempira");
        names.put("14", "Ocotepeque");
        names.put("15", "Olancho");
        names.put("16", "Santa Bárbara");
        names.put("17", "Valle");
        names.put("18", "Yoro");
        NAMES_BY_CODE = Collections.unmodifiableMap(names);

        Map<String, String> codes = new HashMap<>();
        names.forEach((code, name) -> codes.put(key(name), code));
        codes.put(key(Geography.NATIONAL_NAME), Geography.NATIONAL_CODE);
        CODES_BY_KEY = Collections.unmodifiableMap(codes);
    }

    private DepartmentCodes() {
    }

    /**
     * Code for a department name, {@code "00"} when the name is unknown.
     */
    public static String codeFor(String name) {
        if (name == null) {
            return Geography.NATIONAL_CODE;
        }
        return CODES_BY_KEY.getOrDefault(key(name), Geography.NATIONAL_CODE);
    }

    public static Optional<String> nameFor(String code) {
        if (Geography.NATIONAL_CODE.equals(code)) {
            return Optional.of(Geography.NATIONAL_NAME);
        }
        return Optional.ofNullable(NAMES_BY_CODE.get(code));
    }

    public static Map<String, String> all() {
        return NAMES_BY_CODE;
    }

    private static String key(String name) {
        String decomposed = Normalizer.normalize(name.strip(), Normalizer.Form.NFD);
        return decomposed.replaceAll("\\p{M}", "").toUpperCase(Locale.ROOT);
    }
}
