package ir.ipaam.docrender.application.service.render.resolve;

import ir.ipaam.docrender.domain.model.valueobject.RgbColor;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the attribute strings the editor stores on marks. Every parser returns
 * {@code null} for input it cannot make sense of; callers fall back to defaults.
 */
public final class StyleValueParser {

    static final float PX_TO_PT = 0.75f;

    private static final Pattern SIZE = Pattern.compile("^([0-9]*\\.?[0-9]+)\\s*(pt|px|em|rem|%)?$");
    private static final Pattern HEX = Pattern.compile("^#([0-9a-fA-F]{3}|[0-9a-fA-F]{6})$");
    private static final Pattern RGB = Pattern.compile(
            "^rgba?\\(\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*(?:,\\s*[0-9.]+\\s*)?\\)$");

    private StyleValueParser() {
    }

    /**
     * Font size in points. Unitless and {@code pt} values are points, {@code px} is
     * scaled by 0.75, {@code em}/{@code rem}/{@code %} are relative to {@code baseSizePt}.
     */
    public static Float parseSizePt(String value, float baseSizePt) {
        if (value == null) return null;
        Matcher m = SIZE.matcher(value.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) return null;
        float number;
        try {
            number = Float.parseFloat(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
        String unit = m.group(2) == null ? "pt" : m.group(2);
        float pt = switch (unit) {
            case "px" -> number * PX_TO_PT;
            case "em", "rem" -> number * baseSizePt;
            case "%" -> number / 100f * baseSizePt;
            default -> number;
        };
        return pt > 0f && Float.isFinite(pt) ? pt : null;
    }

    public static RgbColor parseColor(String value) {
        if (value == null) return null;
        String v = value.trim();
        Matcher hex = HEX.matcher(v);
        if (hex.matches()) {
            String digits = hex.group(1);
            if (digits.length() == 3) {
                digits = "" + digits.charAt(0) + digits.charAt(0)
                        + digits.charAt(1) + digits.charAt(1)
                        + digits.charAt(2) + digits.charAt(2);
            }
            int rgb = Integer.parseInt(digits, 16);
            return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
        }
        Matcher rgb = RGB.matcher(v.toLowerCase(Locale.ROOT));
        if (rgb.matches()) {
            int r = Integer.parseInt(rgb.group(1));
            int g = Integer.parseInt(rgb.group(2));
            int b = Integer.parseInt(rgb.group(3));
            if (r > 255 || g > 255 || b > 255) return null;
            return new RgbColor(r, g, b);
        }
        return null;
    }
}
