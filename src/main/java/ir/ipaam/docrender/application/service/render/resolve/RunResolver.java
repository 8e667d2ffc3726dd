package ir.ipaam.docrender.application.service.render.resolve;

import ir.ipaam.docrender.domain.model.document.InlineRun;
import ir.ipaam.docrender.domain.model.valueobject.FontFamily;
import ir.ipaam.docrender.domain.model.valueobject.ResolvedRun;
import ir.ipaam.docrender.domain.model.valueobject.RgbColor;
import ir.ipaam.docrender.domain.model.valueobject.Style;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a block's inline content into concrete runs. Resolution order per field is
 * rendering default, then block default, then the run's own mark; each field is
 * merged by its own function below.
 */
public class RunResolver {

    private static final Logger log = LoggerFactory.getLogger(RunResolver.class);

    public List<ResolvedRun> resolve(List<InlineRun> inline, BlockDefaults defaults) {
        List<ResolvedRun> out = new ArrayList<>(inline.size());
        for (InlineRun run : inline) {
            if (run.text().isEmpty()) continue;
            Style style = resolveStyle(run, defaults);
            int last = out.size() - 1;
            if (last >= 0 && out.get(last).style().equals(style)) {
                out.set(last, out.get(last).withText(out.get(last).text() + run.text()));
            } else {
                out.add(new ResolvedRun(run.text(), style));
            }
        }
        return out;
    }

    public Style resolveStyle(InlineRun run, BlockDefaults defaults) {
        return Style.builder()
                .fontFamily(mergeFamily(defaults, run.fontFamily()))
                .fontSizePt(mergeSize(defaults.baseSizePt(), run.fontSize()))
                .bold(defaults.forceBold() || run.bold())
                .italic(defaults.forceItalic() || run.italic())
                .underline(run.underline())
                .strike(run.strike())
                .superscript(run.superscript())
                .subscript(run.subscript() && !run.superscript())
                .color(mergeColor(RgbColor.BLACK, run.color()))
                .highlight(mergeHighlight(run.highlight()))
                .build();
    }

    static FontFamily mergeFamily(BlockDefaults defaults, String explicit) {
        if (defaults.lockFamily() || explicit == null) return defaults.fontFamily();
        FontFamily mapped = FontFamilyTable.lookup(explicit);
        if (mapped == null) {
            log.debug("Unknown font family '{}', using {}", explicit, defaults.fontFamily());
            return defaults.fontFamily();
        }
        return mapped;
    }

    static float mergeSize(float inherited, String explicit) {
        if (explicit == null) return inherited;
        Float parsed = StyleValueParser.parseSizePt(explicit, inherited);
        if (parsed == null) {
            log.debug("Ignoring malformed font size '{}', using {}pt", explicit, inherited);
            return inherited;
        }
        return parsed;
    }

    static RgbColor mergeColor(RgbColor inherited, String explicit) {
        if (explicit == null) return inherited;
        RgbColor parsed = StyleValueParser.parseColor(explicit);
        if (parsed == null) {
            log.debug("Ignoring malformed colour '{}'", explicit);
            return inherited;
        }
        return parsed;
    }

    static RgbColor mergeHighlight(String explicit) {
        if (explicit == null) return null;
        RgbColor parsed = StyleValueParser.parseColor(explicit);
        if (parsed == null) {
            log.debug("Ignoring malformed highlight '{}', using editor default", explicit);
            return RgbColor.EDITOR_HIGHLIGHT;
        }
        return parsed;
    }
}
