package ir.ipaam.docrender.domain.model.page;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Primitive drawing operation in page coordinates: millimetres, origin at the
 * top-left corner, y growing down the page.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextInstruction.class, name = "text"),
        @JsonSubTypes.Type(value = RectInstruction.class, name = "rect"),
        @JsonSubTypes.Type(value = LineInstruction.class, name = "line")
})
public sealed interface DrawInstruction permits TextInstruction, RectInstruction, LineInstruction {

    /** Lowest point on the page this instruction touches. */
    double bottomMm();
}
