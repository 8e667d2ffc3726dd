package ir.ipaam.docrender.application.service.render.output;

import ir.ipaam.docrender.application.service.render.metrics.StandardFonts;
import ir.ipaam.docrender.application.util.PdfTextUtils;
import ir.ipaam.docrender.domain.model.page.DrawInstruction;
import ir.ipaam.docrender.domain.model.page.LineInstruction;
import ir.ipaam.docrender.domain.model.page.OutputArtifact;
import ir.ipaam.docrender.domain.model.page.Page;
import ir.ipaam.docrender.domain.model.page.RectInstruction;
import ir.ipaam.docrender.domain.model.page.TextInstruction;
import ir.ipaam.docrender.domain.model.valueobject.RgbColor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Writes an artifact as a PDF with Apache PDFBox. Artifact coordinates are
 * millimetres from the top-left corner; PDF user space is points from the
 * bottom-left, so every y is flipped against the page height.
 */
@Service
public class PdfBoxOutputEmitter implements OutputEmitter {

    private static final float MM_TO_PT = (float) (72.0 / 25.4);

    @Override
    public String contentType() {
        return MediaType.APPLICATION_PDF_VALUE;
    }

    @Override
    public byte[] emit(OutputArtifact artifact) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream();
             PDDocument doc = new PDDocument()) {

            StandardFonts fonts = new StandardFonts();
            float pageHeightPt = pt(artifact.pageHeightMm());
            PDRectangle mediaBox = new PDRectangle(pt(artifact.pageWidthMm()), pageHeightPt);

            for (Page page : artifact.pages()) {
                PDPage pdPage = new PDPage(mediaBox);
                doc.addPage(pdPage);
                try (PDPageContentStream content = new PDPageContentStream(doc, pdPage)) {
                    for (DrawInstruction instruction : page.instructions()) {
                        draw(content, instruction, fonts, pageHeightPt);
                    }
                }
            }

            doc.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write PDF", e);
        }
    }

    private void draw(PDPageContentStream content, DrawInstruction instruction,
                      StandardFonts fonts, float pageHeightPt) throws IOException {
        if (instruction instanceof TextInstruction text) {
            PDType1Font font = fonts.font(text.font(), text.bold(), text.italic());
            String encodable = PdfTextUtils.toEncodable(text.text(), font);
            if (encodable.isEmpty()) return;
            content.beginText();
            content.setFont(font, text.sizePt());
            fill(content, text.color());
            content.newLineAtOffset(pt(text.x()), pageHeightPt - pt(text.y()));
            content.showText(encodable);
            content.endText();
        } else if (instruction instanceof RectInstruction rect) {
            fill(content, rect.fill());
            content.addRect(pt(rect.x()), pageHeightPt - pt(rect.y() + rect.height()),
                    pt(rect.width()), pt(rect.height()));
            content.fill();
        } else if (instruction instanceof LineInstruction line) {
            content.setStrokingColor(line.color().redFraction(), line.color().greenFraction(),
                    line.color().blueFraction());
            content.setLineWidth(pt(line.strokeWidthMm()));
            content.moveTo(pt(line.x1()), pageHeightPt - pt(line.y1()));
            content.lineTo(pt(line.x2()), pageHeightPt - pt(line.y2()));
            content.stroke();
        }
    }

    private static void fill(PDPageContentStream content, RgbColor color) throws IOException {
        content.setNonStrokingColor(color.redFraction(), color.greenFraction(), color.blueFraction());
    }

    private static float pt(double mm) {
        return (float) (mm * MM_TO_PT);
    }
}
