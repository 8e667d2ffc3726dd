package ir.ipaam.docrender.application.service.render.resolve;

import ir.ipaam.docrender.domain.model.valueobject.FontFamily;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps editor font names onto the nearest output family.
 */
public final class FontFamilyTable {

    private static final Map<String, FontFamily> TABLE = new HashMap<>();

    static {
        for (String name : new String[]{"arial", "helvetica", "helvetica neue", "verdana", "tahoma",
                "trebuchet ms", "inter", "roboto", "open sans", "segoe ui", "system-ui", "sans-serif"}) {
            TABLE.put(name, FontFamily.HELVETICA);
        }
        for (String name : new String[]{"times new roman", "times", "georgia", "garamond", "cambria",
                "palatino", "palatino linotype", "book antiqua", "serif"}) {
            TABLE.put(name, FontFamily.TIMES);
        }
        for (String name : new String[]{"courier new", "courier", "consolas", "monaco", "menlo",
                "lucida console", "monospace"}) {
            TABLE.put(name, FontFamily.COURIER);
        }
    }

    private FontFamilyTable() {
    }

    /**
     * Looks up a CSS-style font stack ("'Open Sans', Arial, sans-serif"); the first
     * known entry wins. Returns {@code null} when nothing in the stack is known.
     */
    public static FontFamily lookup(String fontStack) {
        if (fontStack == null || fontStack.isBlank()) return null;
        for (String entry : fontStack.split(",")) {
            String name = entry.trim()
                    .replace("\"", "")
                    .replace("'", "")
                    .toLowerCase(Locale.ROOT);
            FontFamily family = TABLE.get(name);
            if (family != null) return family;
        }
        return null;
    }
}
