package ir.ipaam.docrender.domain.model.valueobject;

import com.fasterxml.jackson.annotation.JsonValue;

public record RgbColor(int red, int green, int blue) {

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);
    public static final RgbColor EDITOR_HIGHLIGHT = new RgbColor(0xFF, 0xEB, 0x3B);

    public RgbColor {
        if (red < 0 || red > 255 || green < 0 || green > 255 || blue < 0 || blue > 255) {
            throw new IllegalArgumentException("Colour channel out of range: " + red + "," + green + "," + blue);
        }
    }

    @JsonValue
    public String toHex() {
        return String.format("#%02x%02x%02x", red, green, blue);
    }

    public float redFraction() {
        return red / 255f;
    }

    public float greenFraction() {
        return green / 255f;
    }

    public float blueFraction() {
        return blue / 255f;
    }
}
