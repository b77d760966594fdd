package pokeai.data;

import java.util.Locale;

/**
 * Normalises display names into lookup ids: "Heavy-Duty Boots" becomes "heavydutyboots".
 */
public final class Ids {

    private Ids() {}

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    public static boolean same(String a, String b) {
        return normalize(a).equals(normalize(b));
    }
}
