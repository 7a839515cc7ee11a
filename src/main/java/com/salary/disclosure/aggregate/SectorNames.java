package com.salary.disclosure.aggregate;

/**
 * Display normalization for sector names: "COLLEGES" and "colleges" both become
 * "Colleges". A letter is upper-cased when the character before it is not a letter,
 * and lower-cased otherwise.
 */
public final class SectorNames {

    private SectorNames() {
        // Utility class
    }

    public static String titleCase(String sector) {
        if (sector == null) {
            return "";
        }
        StringBuilder result = new StringBuilder(sector.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < sector.length(); i++) {
            char c = sector.charAt(i);
            if (Character.isLetter(c)) {
                result.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                result.append(c);
                previousIsLetter = false;
            }
        }
        return result.toString().trim();
    }
}
