package ir.ipaam.docrender.domain.model.valueobject;

/**
 * Output font families. Each maps onto one of the PDF standard 14 families.
 */
public enum FontFamily {
    HELVETICA,
    TIMES,
    COURIER
}
